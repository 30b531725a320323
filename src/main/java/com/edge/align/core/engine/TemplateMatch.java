package com.edge.align.core.engine;

/**
 * 模板匹配结果：RMSE 得分（16 位量化单位）以及小图在大图中的左上角位置
 */
public class TemplateMatch {
    private final double score;
    private final int offsetX;
    private final int offsetY;

    public TemplateMatch(double score, int offsetX, int offsetY) {
        this.score = score;
        this.offsetX = offsetX;
        this.offsetY = offsetY;
    }

    public double getScore() { return score; }
    public int getOffsetX() { return offsetX; }
    public int getOffsetY() { return offsetY; }

    @Override
    public String toString() {
        return String.format("%.2f @ %d,%d", score, offsetX, offsetY);
    }
}
