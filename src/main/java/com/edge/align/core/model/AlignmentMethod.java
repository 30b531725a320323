package com.edge.align.core.model;

import java.util.Locale;

/**
 * 调用方选择的对齐模式
 */
public enum AlignmentMethod {
    FEATURE,
    PHASE,
    SUBIMAGE,
    /**
     * 先尝试特征点单应性匹配，置信度足够时直接返回
     */
    OPENCV;

    /**
     * 从字符串解析（不区分大小写），null 或空串返回默认的 SUBIMAGE
     */
    public static AlignmentMethod parse(String value) {
        if (value == null || value.isBlank()) {
            return SUBIMAGE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid alignment method: " + value
                + ". Supported: feature, phase, subimage, opencv");
        }
    }
}
