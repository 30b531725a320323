package com.edge.align.core.strategy;

import com.edge.align.core.model.HomographyMatrix;
import com.edge.align.core.model.HomographyTransform;

/**
 * 特征匹配结果：单应性矩阵 + 内点统计
 */
public class FeatureMatchResult {
    private final HomographyMatrix homography;
    private final int inliers;
    private final int totalMatches;

    public FeatureMatchResult(HomographyMatrix homography, int inliers, int totalMatches) {
        this.homography = homography;
        this.inliers = inliers;
        this.totalMatches = totalMatches;
    }

    public HomographyMatrix getHomography() { return homography; }
    public int getInliers() { return inliers; }
    public int getTotalMatches() { return totalMatches; }

    /**
     * 内点比例
     */
    public double getConfidence() {
        return totalMatches == 0 ? 0.0 : (double) inliers / totalMatches;
    }

    public HomographyTransform getTransform() {
        return homography.decompose();
    }

    @Override
    public String toString() {
        return String.format("FeatureMatchResult{inliers=%d/%d, confidence=%.3f}",
            inliers, totalMatches, getConfidence());
    }
}
