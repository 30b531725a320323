package com.edge.align.dto;

import java.util.List;

/**
 * 批量对齐请求
 * <p>
 * 批次级的 method / threshold / opencvDetector 作为每一对的默认值，单对请求中的取值优先
 */
public class BatchAlignRequest {
    private List<AlignRequest> pairs;
    private String method;
    private Double threshold;
    private String opencvDetector;

    public List<AlignRequest> getPairs() { return pairs; }
    public void setPairs(List<AlignRequest> pairs) { this.pairs = pairs; }

    public String getMethod() { return method; }
    public void setMethod(String method) { this.method = method; }

    public Double getThreshold() { return threshold; }
    public void setThreshold(Double threshold) { this.threshold = threshold; }

    public String getOpencvDetector() { return opencvDetector; }
    public void setOpencvDetector(String opencvDetector) { this.opencvDetector = opencvDetector; }

    /**
     * 用批次默认值补齐单对请求中缺省的选项
     */
    public AlignRequest withDefaults(AlignRequest pair) {
        AlignRequest merged = new AlignRequest(pair.getReferencePath(), pair.getTargetPath());
        merged.setOutputPath(pair.getOutputPath());
        merged.setMethod(pair.getMethod() != null ? pair.getMethod() : method);
        merged.setThreshold(pair.getThreshold() != null ? pair.getThreshold() : threshold);
        merged.setOpencvDetector(pair.getOpencvDetector() != null ? pair.getOpencvDetector() : opencvDetector);
        merged.setMaxFeatures(pair.getMaxFeatures());
        return merged;
    }
}
