package com.edge.align.core.strategy;

import com.edge.align.core.model.StrategyId;

import java.util.Optional;

public interface AlignmentStrategy {

    StrategyId id();

    /**
     * 估计目标图相对参考图的位移
     *
     * @param context 本次对齐上下文
     * @return 候选结果；无法给出结果时返回 empty（也可能抛出运行时异常，由级联捕获）
     */
    Optional<StrategyResult> align(AlignmentContext context);
}
