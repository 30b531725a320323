package com.edge.align.core.engine;

import com.edge.align.core.model.Point;

import java.util.Collections;
import java.util.List;

/**
 * 一张图的特征点坐标与描述子
 */
public class FeatureSet implements AutoCloseable {
    private final List<Point> keypoints;
    private final ImageHandle descriptors;

    public FeatureSet(List<Point> keypoints, ImageHandle descriptors) {
        this.keypoints = keypoints != null ? keypoints : Collections.emptyList();
        this.descriptors = descriptors;
    }

    public List<Point> getKeypoints() {
        return keypoints;
    }

    public Point pointAt(int index) {
        return keypoints.get(index);
    }

    public ImageHandle getDescriptors() {
        return descriptors;
    }

    public int size() {
        return keypoints.size();
    }

    public boolean isEmpty() {
        return keypoints.isEmpty() || descriptors == null || descriptors.height() == 0;
    }

    @Override
    public void close() {
        if (descriptors != null) {
            descriptors.close();
        }
    }
}
