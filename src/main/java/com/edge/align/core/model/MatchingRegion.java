package com.edge.align.core.model;

import java.util.Objects;

/**
 * 参考图画布与按位移放置后的目标图之间的重叠矩形
 */
public final class MatchingRegion {
    private final int x;
    private final int y;
    private final int width;
    private final int height;

    public MatchingRegion(int x, int y, int width, int height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    /**
     * 计算重叠区域，宽高截断为非负值
     *
     * @param reference 参考图尺寸（画布）
     * @param target    目标图尺寸
     * @param offset    目标图放置位移
     */
    public static MatchingRegion of(ImageSize reference, ImageSize target, Offset offset) {
        int left = Math.max(0, offset.getX());
        int top = Math.max(0, offset.getY());
        int right = Math.min(reference.getWidth(), offset.getX() + target.getWidth());
        int bottom = Math.min(reference.getHeight(), offset.getY() + target.getHeight());

        int w = Math.max(0, right - left);
        int h = Math.max(0, bottom - top);
        if (w == 0 || h == 0) {
            // 无重叠时保持原点在画布内
            return new MatchingRegion(Math.min(left, reference.getWidth()),
                Math.min(top, reference.getHeight()), 0, 0);
        }
        return new MatchingRegion(left, top, w, h);
    }

    public int getX() { return x; }
    public int getY() { return y; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MatchingRegion)) return false;
        MatchingRegion other = (MatchingRegion) o;
        return x == other.x && y == other.y && width == other.width && height == other.height;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, width, height);
    }

    @Override
    public String toString() {
        return String.format("MatchingRegion{x=%d, y=%d, w=%d, h=%d}", x, y, width, height);
    }
}
