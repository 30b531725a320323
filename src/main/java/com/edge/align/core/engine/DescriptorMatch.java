package com.edge.align.core.engine;

/**
 * 描述子匹配对（query 来自参考图，train 来自目标图）
 */
public class DescriptorMatch {
    private final int queryIdx;
    private final int trainIdx;
    private final float distance;

    public DescriptorMatch(int queryIdx, int trainIdx, float distance) {
        this.queryIdx = queryIdx;
        this.trainIdx = trainIdx;
        this.distance = distance;
    }

    public int getQueryIdx() { return queryIdx; }
    public int getTrainIdx() { return trainIdx; }
    public float getDistance() { return distance; }
}
