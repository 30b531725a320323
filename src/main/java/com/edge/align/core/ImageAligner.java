package com.edge.align.core;

import com.edge.align.core.cascade.CascadeOutcome;
import com.edge.align.core.cascade.StrategyCascade;
import com.edge.align.core.compositor.ResultCompositor;
import com.edge.align.core.engine.ImageEngine;
import com.edge.align.core.engine.ImageEngineException;
import com.edge.align.core.engine.ImageHandle;
import com.edge.align.core.model.AlignmentOptions;
import com.edge.align.core.model.AlignmentResult;
import com.edge.align.core.model.ImageSize;
import com.edge.align.core.model.MatchingRegion;
import com.edge.align.core.strategy.AlignmentContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * 图像对齐入口
 * <p>
 * 每次调用独立创建上下文，不持有可变共享状态，可以被多个线程同时调用。
 * 调用内部单线程，策略严格按级联顺序执行
 */
public class ImageAligner {
    private static final Logger logger = LoggerFactory.getLogger(ImageAligner.class);

    private final ImageEngine engine;
    private final StrategyCascade cascade;
    private final ResultCompositor compositor;
    private final AlignmentSettings settings;

    public ImageAligner(ImageEngine engine, StrategyCascade cascade, ResultCompositor compositor,
                        AlignmentSettings settings) {
        this.engine = engine;
        this.cascade = cascade;
        this.compositor = compositor;
        this.settings = settings != null ? settings : new AlignmentSettings();
    }

    public ImageAligner(ImageEngine engine, AlignmentSettings settings) {
        this(engine, StrategyCascade.standard(null), new ResultCompositor(engine), settings);
    }

    /**
     * 对齐两张图并写出对齐后的目标图
     *
     * @param referencePath 参考图
     * @param targetPath    目标图
     * @param outputPath    输出路径（参考图尺寸，目标图外区域透明）
     * @param options       对齐选项，null 使用默认值
     * @throws AlignmentException 输入无法读取或输出写出失败
     */
    public AlignmentResult alignImages(Path referencePath, Path targetPath, Path outputPath,
                                       AlignmentOptions options) throws AlignmentException {
        String callId = newCallId();
        AlignmentOptions effective = options != null ? options : AlignmentOptions.defaults();

        ImageSize refSize = probe(referencePath);
        ImageSize tgtSize = probe(targetPath);
        logger.info("[{}] Aligning {} ({}) <- {} ({}), {}", callId, referencePath.getFileName(), refSize,
            targetPath.getFileName(), tgtSize, effective);

        try (ImageHandle reference = load(referencePath);
             ImageHandle target = load(targetPath)) {

            AlignmentContext context = new AlignmentContext(callId, engine, reference, target, effective, settings);
            CascadeOutcome outcome = cascade.run(context);

            MatchingRegion region = compositor.compose(reference, target, outcome, outputPath);
            return new AlignmentResult(outputPath.toString(), outcome.getOffset(), region,
                outcome.getMethod(), outcome.getScore(), outcome.getTransform());
        }
    }

    private ImageSize probe(Path path) throws AlignmentException {
        if (!Files.isRegularFile(path)) {
            throw new AlignmentException("Image not found: " + path);
        }
        try {
            return engine.decodeSize(path);
        } catch (ImageEngineException e) {
            throw new AlignmentException("Cannot read image size of " + path + ": " + e.getMessage(), e);
        }
    }

    private ImageHandle load(Path path) throws AlignmentException {
        try {
            return engine.load(path);
        } catch (ImageEngineException e) {
            throw new AlignmentException("Cannot decode image " + path + ": " + e.getMessage(), e);
        }
    }

    private static String newCallId() {
        return "align-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
