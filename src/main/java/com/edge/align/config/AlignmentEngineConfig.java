package com.edge.align.config;

import com.edge.align.core.AlignmentSettings;
import com.edge.align.core.ImageAligner;
import com.edge.align.core.cascade.CascadeListener;
import com.edge.align.core.cascade.LoggingCascadeListener;
import com.edge.align.core.cascade.StrategyCascade;
import com.edge.align.core.compositor.ResultCompositor;
import com.edge.align.core.engine.ImageEngine;
import com.edge.align.core.engine.OpenCvImageEngine;
import com.edge.align.core.model.ImageSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 对齐引擎配置
 * <p>
 * 从 application.yml 读取配置，组装图像引擎、策略级联与对齐入口
 */
@Configuration
public class AlignmentEngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(AlignmentEngineConfig.class);

    @Autowired
    private YamlConfig yamlConfig;

    @Bean
    public ImageEngine imageEngine() {
        YamlConfig.AlignmentConfig alignment = alignmentConfig();
        return new OpenCvImageEngine(alignment.getCannyLow(), alignment.getCannyHigh());
    }

    @Bean
    public AlignmentSettings alignmentSettings() {
        YamlConfig.AlignmentConfig alignment = alignmentConfig();
        YamlConfig.SystemConfig system = systemConfig();

        AlignmentSettings settings = new AlignmentSettings();
        settings.setEdgeThreshold(alignment.getEdgeThreshold());
        settings.setCropThreshold(alignment.getCropThreshold());
        settings.setMultiScaleThreshold(alignment.getMultiScaleThreshold());
        settings.setFeatureConfidence(alignment.getFeatureConfidence());
        settings.setEdgeDownsample(alignment.getEdgeDownsample());
        settings.setCropSizes(parseCropSizes(alignment.getCropSizes()));
        settings.setScales(alignment.getScales());
        settings.setGridStep(alignment.getGridStep());
        settings.setGridMargin(alignment.getGridMargin());
        settings.setGridSizeRatio(alignment.getGridSizeRatio());
        settings.setMatchFraction(alignment.getMatchFraction());
        settings.setMaxFeatures(alignment.getMaxFeatures());
        settings.setRansacThreshold(alignment.getRansacThreshold());
        settings.setInlierThreshold(alignment.getInlierThreshold());
        settings.setMinCorrespondences(alignment.getMinCorrespondences());

        settings.setWorkDir(Paths.get(system.getWorkDir()));
        settings.setDumpIntermediates(system.isDumpIntermediates());
        settings.setKeepIntermediates(system.isKeepIntermediates());

        logger.info("对齐引擎配置: thresholds(edge={}, crop={}, multiScale={}, feature={}), cropSizes={}, scales={}",
            settings.getEdgeThreshold(), settings.getCropThreshold(), settings.getMultiScaleThreshold(),
            settings.getFeatureConfidence(), settings.getCropSizes(), settings.getScales());
        if (settings.isDumpIntermediates()) {
            logger.info("中间产物将写入 {} (keep={})", settings.getWorkDir(), settings.isKeepIntermediates());
        }
        return settings;
    }

    @Bean
    public CascadeListener cascadeListener() {
        return new LoggingCascadeListener();
    }

    @Bean
    public StrategyCascade strategyCascade(CascadeListener cascadeListener) {
        return StrategyCascade.standard(cascadeListener);
    }

    @Bean
    public ImageAligner imageAligner(ImageEngine imageEngine, StrategyCascade strategyCascade,
                                     AlignmentSettings alignmentSettings) {
        return new ImageAligner(imageEngine, strategyCascade, new ResultCompositor(imageEngine), alignmentSettings);
    }

    static List<ImageSize> parseCropSizes(List<String> values) {
        return values.stream().map(ImageSize::parse).collect(Collectors.toList());
    }

    private YamlConfig.AlignmentConfig alignmentConfig() {
        if (yamlConfig.getAlignment() == null) {
            logger.info("使用默认的对齐参数");
            return new YamlConfig.AlignmentConfig();
        }
        return yamlConfig.getAlignment();
    }

    private YamlConfig.SystemConfig systemConfig() {
        return yamlConfig.getSystem() != null ? yamlConfig.getSystem() : new YamlConfig.SystemConfig();
    }
}
