package com.edge.align.core.engine;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

import java.nio.file.Path;
import java.util.Random;

/**
 * 生成 OpenCV 测试图（需要先加载 native 库）
 */
public final class SyntheticImages {

    private SyntheticImages() {
    }

    /**
     * 白底 + 红色方块 + 固定种子的随机色块，子图搜索只有唯一最优位置
     */
    public static Mat screen(int width, int height, long seed) {
        Mat mat = new Mat(height, width, CvType.CV_8UC3, new Scalar(255, 255, 255));
        Random random = new Random(seed);
        for (int i = 0; i < 60; i++) {
            int x = random.nextInt(width - 20);
            int y = random.nextInt(height - 20);
            int w = 10 + random.nextInt(Math.max(1, Math.min(120, width - x - 10)));
            int h = 10 + random.nextInt(Math.max(1, Math.min(80, height - y - 10)));
            Scalar color = new Scalar(random.nextInt(256), random.nextInt(256), random.nextInt(256));
            Imgproc.rectangle(mat, new Point(x, y), new Point(x + w, y + h), color, -1);
        }
        Imgproc.rectangle(mat, new Point(50, 50), new Point(149, 149), new Scalar(0, 0, 255), -1);
        Imgproc.putText(mat, "Settings", new Point(200, 40), Imgproc.FONT_HERSHEY_SIMPLEX, 1.2,
            new Scalar(20, 20, 20), 2);
        return mat;
    }

    public static Path write(Mat mat, Path path) {
        if (!Imgcodecs.imwrite(path.toString(), mat)) {
            throw new IllegalStateException("Could not write " + path);
        }
        return path;
    }

    public static Path writeCrop(Mat mat, int x, int y, int width, int height, Path path) {
        Mat roi = new Mat(mat, new Rect(x, y, width, height));
        try {
            return write(roi, path);
        } finally {
            roi.release();
        }
    }
}
