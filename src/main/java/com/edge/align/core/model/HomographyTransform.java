package com.edge.align.core.model;

/**
 * 单应性矩阵的分解结果（用于报告）
 * <p>
 * 假设近似相似变换：对带透视畸变的矩阵，缩放与旋转只是近似值
 */
public class HomographyTransform {
    private final double translationX;
    private final double translationY;
    private final double scaleX;
    private final double scaleY;
    private final double rotationDegrees;
    private final boolean approximate = true;

    public HomographyTransform(double translationX, double translationY,
                               double scaleX, double scaleY, double rotationDegrees) {
        this.translationX = translationX;
        this.translationY = translationY;
        this.scaleX = scaleX;
        this.scaleY = scaleY;
        this.rotationDegrees = rotationDegrees;
    }

    public double getTranslationX() { return translationX; }
    public double getTranslationY() { return translationY; }
    public double getScaleX() { return scaleX; }
    public double getScaleY() { return scaleY; }
    public double getRotationDegrees() { return rotationDegrees; }
    public boolean isApproximate() { return approximate; }

    /**
     * 平移分量取整作为整数位移
     */
    public Offset toOffset() {
        return new Offset((int) Math.round(translationX), (int) Math.round(translationY));
    }

    @Override
    public String toString() {
        return String.format("HomographyTransform{t=(%.2f, %.2f), scale=(%.3f, %.3f), rotation=%.2f°, approximate}",
            translationX, translationY, scaleX, scaleY, rotationDegrees);
    }
}
