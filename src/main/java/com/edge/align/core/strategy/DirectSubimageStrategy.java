package com.edge.align.core.strategy;

import com.edge.align.core.model.StrategyId;

import java.util.Optional;

/**
 * 在参考图中搜索整张目标图（目标图两个方向都不大于参考图）
 */
public class DirectSubimageStrategy implements AlignmentStrategy {

    @Override
    public StrategyId id() {
        return StrategyId.DIRECT_SUBIMAGE;
    }

    @Override
    public Optional<StrategyResult> align(AlignmentContext context) {
        return SubimageSearch.targetInReference(context.getEngine(),
            context.getReference(), context.getTarget(), id());
    }
}
