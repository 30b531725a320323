package com.edge.align.core.model;

import java.util.Arrays;

/**
 * 3x3 射影变换矩阵（目标图坐标 -> 参考图坐标）
 */
public final class HomographyMatrix {
    private final double[][] m;

    public HomographyMatrix(double[][] values) {
        if (values == null || values.length != 3) {
            throw new IllegalArgumentException("Homography must be 3x3");
        }
        m = new double[3][3];
        for (int i = 0; i < 3; i++) {
            if (values[i].length != 3) {
                throw new IllegalArgumentException("Homography must be 3x3");
            }
            System.arraycopy(values[i], 0, m[i], 0, 3);
        }
    }

    public static HomographyMatrix translation(double tx, double ty) {
        return new HomographyMatrix(new double[][]{
            {1, 0, tx},
            {0, 1, ty},
            {0, 0, 1}
        });
    }

    public double get(int row, int col) {
        return m[row][col];
    }

    public double[][] toArray() {
        double[][] copy = new double[3][];
        for (int i = 0; i < 3; i++) {
            copy[i] = m[i].clone();
        }
        return copy;
    }

    /**
     * 投影一个点，w 为 0 时返回 null
     */
    public Point project(Point p) {
        double w = m[2][0] * p.x + m[2][1] * p.y + m[2][2];
        if (w == 0) {
            return null;
        }
        double tx = (m[0][0] * p.x + m[0][1] * p.y + m[0][2]) / w;
        double ty = (m[1][0] * p.x + m[1][1] * p.y + m[1][2]) / w;
        return new Point(tx, ty);
    }

    /**
     * 分解为平移、缩放、旋转
     * <p>
     * 只对相似变换精确，一般射影矩阵下是近似值
     */
    public HomographyTransform decompose() {
        double a = m[0][0];
        double b = m[0][1];
        double c = m[1][0];
        double d = m[1][1];

        double scaleX = Math.sqrt(a * a + c * c);
        double scaleY = Math.sqrt(b * b + d * d);
        double rotation = Math.toDegrees(Math.atan2(c, a));

        return new HomographyTransform(m[0][2], m[1][2], scaleX, scaleY, rotation);
    }

    @Override
    public String toString() {
        return Arrays.deepToString(m);
    }
}
