package com.edge.align.core.model;

/**
 * 单次对齐调用的选项
 */
public class AlignmentOptions {
    private AlignmentMethod method = AlignmentMethod.SUBIMAGE;
    // 覆盖特征匹配保留比例（matchFraction），为空时使用配置值
    private Double threshold;
    private FeatureDetectorKind opencvDetector = FeatureDetectorKind.ORB;
    private Integer maxFeatures;

    public AlignmentOptions() {
    }

    public AlignmentOptions(AlignmentMethod method) {
        this.method = method;
    }

    public static AlignmentOptions defaults() {
        return new AlignmentOptions();
    }

    /**
     * 从外部字符串参数构建，非法取值抛出 IllegalArgumentException
     */
    public static AlignmentOptions of(String method, Double threshold, String detector) {
        AlignmentOptions options = new AlignmentOptions(AlignmentMethod.parse(method));
        options.setThreshold(threshold);
        options.setOpencvDetector(FeatureDetectorKind.parse(detector));
        return options;
    }

    public AlignmentMethod getMethod() { return method; }
    public void setMethod(AlignmentMethod method) {
        this.method = method != null ? method : AlignmentMethod.SUBIMAGE;
    }

    public Double getThreshold() { return threshold; }
    public void setThreshold(Double threshold) {
        if (threshold != null && (threshold <= 0 || threshold > 1)) {
            throw new IllegalArgumentException("threshold must be in (0, 1], got " + threshold);
        }
        this.threshold = threshold;
    }

    public FeatureDetectorKind getOpencvDetector() { return opencvDetector; }
    public void setOpencvDetector(FeatureDetectorKind opencvDetector) {
        this.opencvDetector = opencvDetector != null ? opencvDetector : FeatureDetectorKind.ORB;
    }

    public Integer getMaxFeatures() { return maxFeatures; }
    public void setMaxFeatures(Integer maxFeatures) { this.maxFeatures = maxFeatures; }

    @Override
    public String toString() {
        return "AlignmentOptions{method=" + method + ", threshold=" + threshold
            + ", detector=" + opencvDetector + ", maxFeatures=" + maxFeatures + "}";
    }
}
