package com.edge.align.core.strategy;

import com.edge.align.core.AlignmentSettings;
import com.edge.align.core.engine.ArtifactScope;
import com.edge.align.core.engine.ImageEngine;
import com.edge.align.core.engine.ImageEngineException;
import com.edge.align.core.engine.ImageHandle;
import com.edge.align.core.engine.TemplateMatch;
import com.edge.align.core.model.ImageSize;
import com.edge.align.core.model.Offset;
import com.edge.align.core.model.StrategyId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 多尺度搜索
 * <p>
 * 尺度 1.0：暴力网格搜索。两图宽高比例都在阈值内时，按固定步长遍历
 * [-(尺寸差 + 边距), +(尺寸差 + 边距)] 范围内的位移，把目标图合成到参考图尺寸的画布上计算 RMSE。
 * 其他尺度：两图按比例缩小后做子图搜索（先直接，后反向），位移按 1/scale 放大。
 * 返回所有尺度中得分最低的结果
 */
public class MultiScaleStrategy implements AlignmentStrategy {
    private static final Logger logger = LoggerFactory.getLogger(MultiScaleStrategy.class);

    @Override
    public StrategyId id() {
        return StrategyId.MULTI_SCALE;
    }

    @Override
    public Optional<StrategyResult> align(AlignmentContext context) {
        StrategyResult best = null;

        for (double scale : context.getSettings().getScales()) {
            Optional<StrategyResult> candidate;
            try {
                candidate = scale >= 1.0 ? gridSearch(context) : reducedScaleSearch(context, scale);
            } catch (ImageEngineException e) {
                logger.debug("[{}] Scale {} failed: {}", context.getCallId(), scale, e.getMessage());
                continue;
            }

            if (candidate.isPresent()) {
                StrategyResult r = candidate.get();
                logger.debug("[{}] Scale {} -> {}", context.getCallId(), scale, r);
                if (best == null || r.getScore() < best.getScore()) {
                    best = r;
                }
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * 全尺寸网格搜索
     */
    Optional<StrategyResult> gridSearch(AlignmentContext context) {
        AlignmentSettings settings = context.getSettings();
        ImageSize refSize = context.getReferenceSize();
        ImageSize tgtSize = context.getTargetSize();

        if (!withinRatio(refSize.getWidth(), tgtSize.getWidth(), settings.getGridSizeRatio())
            || !withinRatio(refSize.getHeight(), tgtSize.getHeight(), settings.getGridSizeRatio())) {
            logger.debug("[{}] Grid search skipped: sizes {} and {} differ too much",
                context.getCallId(), refSize, tgtSize);
            return Optional.empty();
        }

        ImageEngine engine = context.getEngine();
        int step = settings.getGridStep();
        int rangeX = Math.abs(refSize.getWidth() - tgtSize.getWidth()) + settings.getGridMargin();
        int rangeY = Math.abs(refSize.getHeight() - tgtSize.getHeight()) + settings.getGridMargin();

        double bestScore = Double.POSITIVE_INFINITY;
        Offset bestOffset = null;
        int evaluated = 0;

        for (int dy = -rangeY; dy <= rangeY; dy += step) {
            for (int dx = -rangeX; dx <= rangeX; dx += step) {
                try (ImageHandle canvas = engine.composite(refSize, context.getTarget(), dx, dy, false)) {
                    TemplateMatch match = engine.templateMatch(context.getReference(), canvas);
                    evaluated++;
                    if (match.getScore() < bestScore) {
                        bestScore = match.getScore();
                        bestOffset = new Offset(dx, dy);
                    }
                }
            }
        }

        logger.debug("[{}] Grid search evaluated {} offsets (step {}, range ±{}/±{}), best={} @ {}",
            context.getCallId(), evaluated, step, rangeX, rangeY,
            String.format("%.2f", bestScore), bestOffset);

        if (bestOffset == null) {
            return Optional.empty();
        }
        return Optional.of(new StrategyResult(bestScore, bestOffset, id()));
    }

    /**
     * 缩小后的子图搜索
     */
    Optional<StrategyResult> reducedScaleSearch(AlignmentContext context, double scale) {
        ImageEngine engine = context.getEngine();
        try (ArtifactScope scope = context.openScope(id().getKey() + "-" + scale)) {
            ImageHandle refSmall = scope.track(engine.resize(context.getReference(), scale * 100), "ref-scaled");
            ImageHandle tgtSmall = scope.track(engine.resize(context.getTarget(), scale * 100), "target-scaled");

            return SubimageSearch.eitherDirection(engine, refSmall, tgtSmall, id())
                .map(r -> r.withOffset(r.getOffset().scale(1.0 / scale)));
        }
    }

    private static boolean withinRatio(int a, int b, double ratio) {
        int max = Math.max(a, b);
        if (max == 0) {
            return false;
        }
        return (double) Math.min(a, b) / max >= ratio;
    }
}
