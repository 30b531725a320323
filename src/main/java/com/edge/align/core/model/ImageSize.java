package com.edge.align.core.model;

import java.util.Objects;

/**
 * 图像尺寸
 */
public final class ImageSize {
    private final int width;
    private final int height;

    public ImageSize(int width, int height) {
        this.width = width;
        this.height = height;
    }

    /**
     * 解析 "宽x高" 格式，如 800x600
     */
    public static ImageSize parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Size must not be null");
        }
        String[] parts = value.trim().toLowerCase(java.util.Locale.ROOT).split("x");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid size '" + value + "', expected WIDTHxHEIGHT");
        }
        try {
            int w = Integer.parseInt(parts[0].trim());
            int h = Integer.parseInt(parts[1].trim());
            if (w <= 0 || h <= 0) {
                throw new IllegalArgumentException("Size must be positive: " + value);
            }
            return new ImageSize(w, h);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid size '" + value + "', expected WIDTHxHEIGHT", e);
        }
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }

    /**
     * 本尺寸在两个方向上都不超过 other
     */
    public boolean fitsWithin(ImageSize other) {
        return width <= other.width && height <= other.height;
    }

    public ImageSize union(ImageSize other) {
        return new ImageSize(Math.max(width, other.width), Math.max(height, other.height));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImageSize)) return false;
        ImageSize other = (ImageSize) o;
        return width == other.width && height == other.height;
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, height);
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
