package com.edge.align.core.compositor;

import com.edge.align.core.AlignmentException;
import com.edge.align.core.cascade.CascadeOutcome;
import com.edge.align.core.engine.ImageEngine;
import com.edge.align.core.engine.ImageEngineException;
import com.edge.align.core.engine.ImageHandle;
import com.edge.align.core.model.ImageSize;
import com.edge.align.core.model.MatchingRegion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * 结果合成器
 * <p>
 * 按胜出的位移（或单应性矩阵）把目标图放到参考图尺寸的透明画布上并写出，
 * 同时计算重叠区域。写出失败是致命错误，包装为 AlignmentException
 */
public class ResultCompositor {
    private static final Logger logger = LoggerFactory.getLogger(ResultCompositor.class);

    private final ImageEngine engine;

    public ResultCompositor(ImageEngine engine) {
        this.engine = engine;
    }

    public MatchingRegion compose(ImageHandle reference, ImageHandle target, CascadeOutcome outcome,
                                  Path outputPath) throws AlignmentException {
        ImageSize canvas = reference.size();

        try (ImageHandle aligned = outcome.getHomography() != null
            ? engine.warpPerspective(target, outcome.getHomography(), canvas)
            : engine.composite(canvas, target, outcome.getOffset().getX(), outcome.getOffset().getY(), true)) {
            engine.write(aligned, outputPath);
        } catch (ImageEngineException e) {
            throw new AlignmentException("Failed to write aligned image to " + outputPath + ": " + e.getMessage(), e);
        }

        MatchingRegion region = MatchingRegion.of(canvas, target.size(), outcome.getOffset());
        logger.debug("Aligned image written to {}, matching region {}", outputPath, region);
        return region;
    }
}
