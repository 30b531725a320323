package com.edge.align.core.model;

import java.util.Locale;

/**
 * 特征检测器类型（三者均输出二进制描述子，统一使用汉明距离匹配）
 */
public enum FeatureDetectorKind {
    ORB,
    AKAZE,
    BRISK;

    public static FeatureDetectorKind parse(String value) {
        if (value == null || value.isBlank()) {
            return ORB;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid feature detector: " + value
                + ". Supported: orb, akaze, brisk");
        }
    }
}
