package com.edge.align.core.cascade;

import com.edge.align.core.model.StrategyId;
import com.edge.align.core.strategy.AlignmentContext;
import com.edge.align.core.strategy.StrategyResult;

/**
 * 级联事件回调
 */
public interface CascadeListener {

    CascadeListener NOOP = new CascadeListener() {
    };

    default void onAttempt(AlignmentContext context, StrategyId strategy) {
    }

    default void onSkip(AlignmentContext context, StrategyId strategy, String reason) {
    }

    /**
     * 策略给出了候选（已完成方向取反）
     */
    default void onCandidate(AlignmentContext context, StrategyResult candidate, boolean newBest) {
    }

    /**
     * 策略未给出候选；cause 为 null 表示策略正常返回空结果
     */
    default void onNoCandidate(AlignmentContext context, StrategyId strategy, Throwable cause) {
    }

    /**
     * 特征匹配置信度足够，跳过后续策略
     */
    default void onShortCircuit(AlignmentContext context, StrategyId strategy, double confidence) {
    }

    default void onFinish(AlignmentContext context, CascadeOutcome outcome, long elapsedMillis) {
    }
}
