package com.edge.align.dto;

import com.edge.align.core.model.AlignmentOptions;

/**
 * 单对图像对齐请求（服务器本地路径）
 */
public class AlignRequest {
    private String referencePath;
    private String targetPath;
    // 为空时写入默认输出目录
    private String outputPath;

    private String method;          // feature / phase / subimage / opencv
    private Double threshold;       // 特征匹配保留比例 (0, 1]
    private String opencvDetector;  // orb / akaze / brisk
    private Integer maxFeatures;

    public AlignRequest() {
    }

    public AlignRequest(String referencePath, String targetPath) {
        this.referencePath = referencePath;
        this.targetPath = targetPath;
    }

    /**
     * 转换为对齐选项，非法取值抛出 IllegalArgumentException
     */
    public AlignmentOptions toOptions() {
        AlignmentOptions options = AlignmentOptions.of(method, threshold, opencvDetector);
        if (maxFeatures != null) {
            if (maxFeatures <= 0) {
                throw new IllegalArgumentException("maxFeatures must be positive, got " + maxFeatures);
            }
            options.setMaxFeatures(maxFeatures);
        }
        return options;
    }

    public String getReferencePath() { return referencePath; }
    public void setReferencePath(String referencePath) { this.referencePath = referencePath; }

    public String getTargetPath() { return targetPath; }
    public void setTargetPath(String targetPath) { this.targetPath = targetPath; }

    public String getOutputPath() { return outputPath; }
    public void setOutputPath(String outputPath) { this.outputPath = outputPath; }

    public String getMethod() { return method; }
    public void setMethod(String method) { this.method = method; }

    public Double getThreshold() { return threshold; }
    public void setThreshold(Double threshold) { this.threshold = threshold; }

    public String getOpencvDetector() { return opencvDetector; }
    public void setOpencvDetector(String opencvDetector) { this.opencvDetector = opencvDetector; }

    public Integer getMaxFeatures() { return maxFeatures; }
    public void setMaxFeatures(Integer maxFeatures) { this.maxFeatures = maxFeatures; }
}
