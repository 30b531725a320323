package com.edge.align.core.strategy;

import com.edge.align.core.model.StrategyId;

import java.util.Optional;

/**
 * 在目标图中搜索整张参考图（参考图两个方向都不大于目标图）
 * <p>
 * 返回的是参考图在目标图中的位置，搜索方向与直接搜索相反，
 * 级联控制器比较前会把位移取反
 */
public class ReverseSubimageStrategy implements AlignmentStrategy {

    @Override
    public StrategyId id() {
        return StrategyId.REVERSE_SUBIMAGE;
    }

    @Override
    public Optional<StrategyResult> align(AlignmentContext context) {
        return SubimageSearch.referenceInTarget(context.getEngine(),
            context.getReference(), context.getTarget(), id());
    }
}
