package com.edge.align.core.engine;

/**
 * 测试用图像句柄：只有尺寸和来源描述，没有像素
 */
public class FakeImage implements ImageHandle {
    private final String name;
    private final int width;
    private final int height;
    private final int channels;
    private int closeCount = 0;

    public FakeImage(String name, int width, int height, int channels) {
        this.name = name;
        this.width = width;
        this.height = height;
        this.channels = channels;
    }

    public FakeImage(String name, int width, int height) {
        this(name, width, height, 3);
    }

    public String getName() { return name; }

    public boolean isClosed() { return closeCount > 0; }

    public int getCloseCount() { return closeCount; }

    @Override
    public int width() { return width; }

    @Override
    public int height() { return height; }

    @Override
    public int channels() { return channels; }

    @Override
    public void close() {
        closeCount++;
    }

    @Override
    public String toString() {
        return name + "[" + width + "x" + height + "]";
    }
}
