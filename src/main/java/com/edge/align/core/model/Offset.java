package com.edge.align.core.model;

import java.util.Objects;

/**
 * 目标图相对参考图的整数位移
 * <p>
 * 符号约定：x/y 为正表示目标图需要向右/向下移动才能与参考图重合
 */
public final class Offset {
    public static final Offset ZERO = new Offset(0, 0);

    private final int x;
    private final int y;

    public Offset(int x, int y) {
        this.x = x;
        this.y = y;
    }

    public int getX() { return x; }
    public int getY() { return y; }

    /**
     * 反向位移，用于参考图在目标图内搜索时的方向翻转
     */
    public Offset negate() {
        return new Offset(-x, -y);
    }

    /**
     * 按系数放大（降采样后映射回原分辨率）
     */
    public Offset scale(double factor) {
        return new Offset((int) Math.round(x * factor), (int) Math.round(y * factor));
    }

    public boolean isZero() {
        return x == 0 && y == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Offset)) return false;
        Offset other = (Offset) o;
        return x == other.x && y == other.y;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
