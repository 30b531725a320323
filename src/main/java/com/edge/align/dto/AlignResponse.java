package com.edge.align.dto;

import com.edge.align.core.model.AlignmentResult;
import com.edge.align.core.model.HomographyTransform;
import com.edge.align.core.model.MatchingRegion;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单对图像对齐响应
 */
public class AlignResponse {
    private String alignedPath;
    private Map<String, Integer> offset;
    private Map<String, Integer> matchingRegion;
    private String method;
    private double score;
    // 仅特征匹配短路返回时存在，数值为近似值
    private Map<String, Object> transform;
    private long durationMs;

    public static AlignResponse from(AlignmentResult result, long durationMs) {
        AlignResponse response = new AlignResponse();
        response.alignedPath = result.getAlignedPath();

        response.offset = new LinkedHashMap<>();
        response.offset.put("x", result.getOffset().getX());
        response.offset.put("y", result.getOffset().getY());

        MatchingRegion region = result.getMatchingRegion();
        response.matchingRegion = new LinkedHashMap<>();
        response.matchingRegion.put("x", region.getX());
        response.matchingRegion.put("y", region.getY());
        response.matchingRegion.put("width", region.getWidth());
        response.matchingRegion.put("height", region.getHeight());

        response.method = result.getMethod().getKey();
        response.score = Double.isInfinite(result.getScore()) ? -1 : result.getScore();

        HomographyTransform t = result.getTransform();
        if (t != null) {
            response.transform = new LinkedHashMap<>();
            response.transform.put("translationX", t.getTranslationX());
            response.transform.put("translationY", t.getTranslationY());
            response.transform.put("scaleX", t.getScaleX());
            response.transform.put("scaleY", t.getScaleY());
            response.transform.put("rotationDegrees", t.getRotationDegrees());
            response.transform.put("approximate", t.isApproximate());
        }
        response.durationMs = durationMs;
        return response;
    }

    public String getAlignedPath() { return alignedPath; }
    public void setAlignedPath(String alignedPath) { this.alignedPath = alignedPath; }

    public Map<String, Integer> getOffset() { return offset; }
    public void setOffset(Map<String, Integer> offset) { this.offset = offset; }

    public Map<String, Integer> getMatchingRegion() { return matchingRegion; }
    public void setMatchingRegion(Map<String, Integer> matchingRegion) { this.matchingRegion = matchingRegion; }

    /**
     * 胜出策略，none 表示所有策略均无结果（位移为 0）
     */
    public String getMethod() { return method; }
    public void setMethod(String method) { this.method = method; }

    /**
     * 得分，-1 表示没有候选
     */
    public double getScore() { return score; }
    public void setScore(double score) { this.score = score; }

    public Map<String, Object> getTransform() { return transform; }
    public void setTransform(Map<String, Object> transform) { this.transform = transform; }

    public long getDurationMs() { return durationMs; }
    public void setDurationMs(long durationMs) { this.durationMs = durationMs; }
}
