package com.edge.align.core.strategy;

import com.edge.align.core.engine.ArtifactScope;
import com.edge.align.core.engine.ImageEngine;
import com.edge.align.core.engine.ImageHandle;
import com.edge.align.core.model.StrategyId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 边缘图子图搜索
 * <p>
 * 流程：
 * 1. 两张图转为反色边缘图（对主题色、颜色变化不敏感）
 * 2. 按固定倍数降采样，控制计算量
 * 3. 在小边缘图上做子图搜索（先直接，后反向）
 * 4. 位移乘以降采样倍数映射回原分辨率（损失部分定位精度）
 */
public class EdgeBasedStrategy implements AlignmentStrategy {
    private static final Logger logger = LoggerFactory.getLogger(EdgeBasedStrategy.class);

    @Override
    public StrategyId id() {
        return StrategyId.EDGE_BASED;
    }

    @Override
    public Optional<StrategyResult> align(AlignmentContext context) {
        ImageEngine engine = context.getEngine();
        int factor = context.getSettings().getEdgeDownsample();
        double percent = 100.0 / factor;

        try (ArtifactScope scope = context.openScope(id().getKey())) {
            ImageHandle refEdges = scope.track(engine.edgeDetect(context.getReference()), "ref-edges");
            ImageHandle tgtEdges = scope.track(engine.edgeDetect(context.getTarget()), "target-edges");

            ImageHandle refSmall = scope.track(engine.resize(refEdges, percent), "ref-edges-small");
            ImageHandle tgtSmall = scope.track(engine.resize(tgtEdges, percent), "target-edges-small");

            logger.debug("[{}] Edge maps downsampled {}x: ref={}, target={}",
                context.getCallId(), factor, refSmall.size(), tgtSmall.size());

            return SubimageSearch.eitherDirection(engine, refSmall, tgtSmall, id())
                .map(r -> r.withOffset(r.getOffset().scale(factor)));
        }
    }
}
