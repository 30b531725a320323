package com.edge.align.core.engine;

import org.opencv.core.Mat;

/**
 * 基于 OpenCV Mat 的图像句柄
 */
public class MatImageHandle implements ImageHandle {
    private final Mat mat;
    private volatile boolean released = false;

    public MatImageHandle(Mat mat) {
        if (mat == null) {
            throw new IllegalArgumentException("Mat cannot be null");
        }
        this.mat = mat;
    }

    /**
     * 取出底层 Mat，已释放的句柄直接报错
     */
    public Mat mat() {
        if (released) {
            throw new ImageEngineException("Image handle already released");
        }
        return mat;
    }

    @Override
    public int width() {
        return mat.cols();
    }

    @Override
    public int height() {
        return mat.rows();
    }

    @Override
    public int channels() {
        return mat.channels();
    }

    public boolean isReleased() {
        return released;
    }

    @Override
    public synchronized void close() {
        if (!released) {
            mat.release();
            released = true;
        }
    }

    @Override
    public String toString() {
        return "MatImageHandle{" + width() + "x" + height() + "x" + channels()
            + (released ? ", released" : "") + "}";
    }
}
