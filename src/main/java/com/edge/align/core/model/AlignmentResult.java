package com.edge.align.core.model;

/**
 * 对齐结果：输出路径、位移、重叠区域
 */
public class AlignmentResult {
    private final String alignedPath;
    private final Offset offset;
    private final MatchingRegion matchingRegion;
    private final StrategyId method;
    private final double score;
    // 仅在特征匹配直接返回时存在
    private final HomographyTransform transform;

    public AlignmentResult(String alignedPath, Offset offset, MatchingRegion matchingRegion,
                           StrategyId method, double score, HomographyTransform transform) {
        this.alignedPath = alignedPath;
        this.offset = offset;
        this.matchingRegion = matchingRegion;
        this.method = method;
        this.score = score;
        this.transform = transform;
    }

    public String getAlignedPath() { return alignedPath; }
    public Offset getOffset() { return offset; }
    public MatchingRegion getMatchingRegion() { return matchingRegion; }
    public StrategyId getMethod() { return method; }
    public double getScore() { return score; }
    public HomographyTransform getTransform() { return transform; }

    @Override
    public String toString() {
        return "AlignmentResult{alignedPath='" + alignedPath + "', offset=" + offset
            + ", region=" + matchingRegion + ", method=" + method.getKey()
            + ", score=" + String.format("%.2f", score)
            + (transform != null ? ", transform=" + transform : "") + "}";
    }
}
