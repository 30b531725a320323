package com.edge.align.core.strategy;

import com.edge.align.core.engine.ArtifactScope;
import com.edge.align.core.engine.ImageEngine;
import com.edge.align.core.engine.ImageHandle;
import com.edge.align.core.model.ImageSize;
import com.edge.align.core.model.Offset;
import com.edge.align.core.model.StrategyId;

import java.util.Optional;

/**
 * 归一化互相关兜底
 * <p>
 * 两图转灰度并填充到相同尺寸，得分为 1 - 相关系数。
 * 位移恒为 (0, 0)：只表示"没有更好的信息"，不是真正的相位相关配准
 */
public class PhaseCorrelationStrategy implements AlignmentStrategy {

    @Override
    public StrategyId id() {
        return StrategyId.PHASE_CORRELATION;
    }

    @Override
    public Optional<StrategyResult> align(AlignmentContext context) {
        ImageEngine engine = context.getEngine();
        ImageSize canvas = context.getReferenceSize().union(context.getTargetSize());

        try (ArtifactScope scope = context.openScope(id().getKey())) {
            ImageHandle refGray = scope.track(engine.grayscaleAndPad(context.getReference(), canvas), "ref-gray");
            ImageHandle tgtGray = scope.track(engine.grayscaleAndPad(context.getTarget(), canvas), "target-gray");

            double correlation = engine.normalizedCrossCorrelation(refGray, tgtGray);
            double distance = Math.max(0.0, 1.0 - correlation);
            return Optional.of(new StrategyResult(distance, Offset.ZERO, id()));
        }
    }
}
