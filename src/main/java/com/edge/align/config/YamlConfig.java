package com.edge.align.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "edge-align")
public class YamlConfig {
    private SystemConfig system;
    private AlignmentConfig alignment;
    private BatchConfig batch;

    @Data
    public static class SystemConfig {
        private String workDir = "data/work";
        // 请求未指定输出路径时的默认输出目录
        private String outputDir = "data/aligned";
        // 策略中间产物是否写入工作目录（排查问题用）
        private boolean dumpIntermediates = false;
        private boolean keepIntermediates = false;
        private boolean saveRecords = true;
        private String recordsDir = "data/records";
    }

    @Data
    public static class AlignmentConfig {
        // 升级阈值
        private double edgeThreshold = 1000;
        private double cropThreshold = 5000;
        private double multiScaleThreshold = 1000;
        private double featureConfidence = 0.3;

        private int edgeDownsample = 4;
        // 格式 宽x高
        private List<String> cropSizes = new ArrayList<>(Arrays.asList("800x600", "1000x800", "1200x900"));

        // 多尺度
        private List<Double> scales = new ArrayList<>(Arrays.asList(1.0, 0.5, 0.25));
        private int gridStep = 50;
        private int gridMargin = 200;
        private double gridSizeRatio = 0.7;

        // 特征匹配
        private double matchFraction = 0.7;
        private int maxFeatures = 1000;
        private double ransacThreshold = 5.0;
        private double inlierThreshold = 5.0;
        private int minCorrespondences = 4;

        // Canny 边缘检测
        private double cannyLow = 50;
        private double cannyHigh = 150;
    }

    @Data
    public static class BatchConfig {
        private int concurrency = 4;
        // 0 表示不限时
        private long pairTimeoutSeconds = 0;
    }
}
