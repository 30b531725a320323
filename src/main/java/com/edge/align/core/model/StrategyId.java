package com.edge.align.core.model;

/**
 * 对齐策略标识
 * <p>
 * 顺序即级联顺序（特征匹配除外，它只在 opencv 模式下最先尝试）
 */
public enum StrategyId {
    /**
     * 尚无候选结果
     */
    NONE("none"),

    /**
     * 特征点单应性匹配
     * 优点：支持旋转、缩放、透视
     * 缺点：需要纹理丰富的图像，UI 截图中的纯色区域特征点很少
     */
    FEATURE_HOMOGRAPHY("opencv-feature"),

    /**
     * 目标图在参考图内的子图搜索
     * 前提：目标图两个方向都不大于参考图
     */
    DIRECT_SUBIMAGE("target-in-ref"),

    /**
     * 参考图在目标图内的子图搜索，结果位移取反
     * 前提：参考图两个方向都不大于目标图
     */
    REVERSE_SUBIMAGE("ref-in-target"),

    /**
     * 边缘图 + 4 倍降采样后的子图搜索
     * 适用场景：主题色、颜色变化导致像素 RMSE 失真
     */
    EDGE_BASED("edge-based"),

    /**
     * 中心裁剪区域比对
     * 适用场景：两图共享较大中心区域，但边框、留白不同
     */
    CROPPED_REGION("cropped-region"),

    /**
     * 多尺度搜索（全尺寸网格搜索 + 降采样子图搜索）
     * 最耗时，只在前面策略得分较差时使用
     */
    MULTI_SCALE("multi-scale"),

    /**
     * 归一化互相关兜底，只给出置信度，不给出位移
     */
    PHASE_CORRELATION("phase-correlation");

    private final String key;

    StrategyId(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
