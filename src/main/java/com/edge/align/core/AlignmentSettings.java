package com.edge.align.core;

import com.edge.align.core.model.ImageSize;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * 对齐引擎参数
 * <p>
 * 得分阈值是各策略误差量纲下的经验值，不是归一化概率。
 * 默认值与 application.yml 保持一致
 */
public class AlignmentSettings {
    // 升级阈值（RMSE，16 位量化单位）
    private double edgeThreshold = 1000;
    private double cropThreshold = 5000;
    private double multiScaleThreshold = 1000;
    // 特征匹配直接返回所需的内点比例
    private double featureConfidence = 0.3;

    // 边缘图降采样倍数
    private int edgeDownsample = 4;

    // 中心裁剪候选尺寸，按顺序尝试
    private List<ImageSize> cropSizes = Arrays.asList(
        new ImageSize(800, 600),
        new ImageSize(1000, 800),
        new ImageSize(1200, 900));

    // 多尺度搜索
    private List<Double> scales = Arrays.asList(1.0, 0.5, 0.25);
    private int gridStep = 50;
    private int gridMargin = 200;
    private double gridSizeRatio = 0.7;

    // 特征匹配
    private double matchFraction = 0.7;
    private int maxFeatures = 1000;
    private double ransacThreshold = 5.0;
    private double inlierThreshold = 5.0;
    private int minCorrespondences = 4;

    // 中间产物落盘
    private Path workDir;
    private boolean dumpIntermediates = false;
    private boolean keepIntermediates = false;

    public double getEdgeThreshold() { return edgeThreshold; }
    public void setEdgeThreshold(double edgeThreshold) { this.edgeThreshold = edgeThreshold; }

    public double getCropThreshold() { return cropThreshold; }
    public void setCropThreshold(double cropThreshold) { this.cropThreshold = cropThreshold; }

    public double getMultiScaleThreshold() { return multiScaleThreshold; }
    public void setMultiScaleThreshold(double multiScaleThreshold) { this.multiScaleThreshold = multiScaleThreshold; }

    public double getFeatureConfidence() { return featureConfidence; }
    public void setFeatureConfidence(double featureConfidence) { this.featureConfidence = featureConfidence; }

    public int getEdgeDownsample() { return edgeDownsample; }
    public void setEdgeDownsample(int edgeDownsample) {
        if (edgeDownsample < 1) {
            throw new IllegalArgumentException("edgeDownsample must be >= 1");
        }
        this.edgeDownsample = edgeDownsample;
    }

    public List<ImageSize> getCropSizes() { return cropSizes; }
    public void setCropSizes(List<ImageSize> cropSizes) { this.cropSizes = cropSizes; }

    public List<Double> getScales() { return scales; }
    public void setScales(List<Double> scales) {
        for (Double scale : scales) {
            if (scale == null || scale <= 0 || scale > 1) {
                throw new IllegalArgumentException("scales must be in (0, 1], got " + scale);
            }
        }
        this.scales = scales;
    }

    public int getGridStep() { return gridStep; }
    public void setGridStep(int gridStep) {
        if (gridStep < 1) {
            throw new IllegalArgumentException("gridStep must be >= 1");
        }
        this.gridStep = gridStep;
    }

    public int getGridMargin() { return gridMargin; }
    public void setGridMargin(int gridMargin) { this.gridMargin = gridMargin; }

    public double getGridSizeRatio() { return gridSizeRatio; }
    public void setGridSizeRatio(double gridSizeRatio) { this.gridSizeRatio = gridSizeRatio; }

    public double getMatchFraction() { return matchFraction; }
    public void setMatchFraction(double matchFraction) { this.matchFraction = matchFraction; }

    public int getMaxFeatures() { return maxFeatures; }
    public void setMaxFeatures(int maxFeatures) { this.maxFeatures = maxFeatures; }

    public double getRansacThreshold() { return ransacThreshold; }
    public void setRansacThreshold(double ransacThreshold) { this.ransacThreshold = ransacThreshold; }

    public double getInlierThreshold() { return inlierThreshold; }
    public void setInlierThreshold(double inlierThreshold) { this.inlierThreshold = inlierThreshold; }

    public int getMinCorrespondences() { return minCorrespondences; }
    public void setMinCorrespondences(int minCorrespondences) { this.minCorrespondences = minCorrespondences; }

    public Path getWorkDir() { return workDir; }
    public void setWorkDir(Path workDir) { this.workDir = workDir; }

    public boolean isDumpIntermediates() { return dumpIntermediates; }
    public void setDumpIntermediates(boolean dumpIntermediates) { this.dumpIntermediates = dumpIntermediates; }

    public boolean isKeepIntermediates() { return keepIntermediates; }
    public void setKeepIntermediates(boolean keepIntermediates) { this.keepIntermediates = keepIntermediates; }
}
