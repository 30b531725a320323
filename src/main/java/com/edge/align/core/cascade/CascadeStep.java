package com.edge.align.core.cascade;

import com.edge.align.core.strategy.AlignmentContext;
import com.edge.align.core.strategy.AlignmentStrategy;

import java.util.function.BiPredicate;

/**
 * 级联中的一步：前置条件 + 策略
 */
public class CascadeStep {
    private final AlignmentStrategy strategy;
    private final String condition;
    private final BiPredicate<AlignmentContext, BestMatch> precondition;
    // 反向搜索的结果需要取反
    private final boolean invertOffset;

    public CascadeStep(AlignmentStrategy strategy, String condition,
                       BiPredicate<AlignmentContext, BestMatch> precondition, boolean invertOffset) {
        this.strategy = strategy;
        this.condition = condition;
        this.precondition = precondition;
        this.invertOffset = invertOffset;
    }

    public CascadeStep(AlignmentStrategy strategy, String condition,
                       BiPredicate<AlignmentContext, BestMatch> precondition) {
        this(strategy, condition, precondition, false);
    }

    public boolean isEligible(AlignmentContext context, BestMatch best) {
        return precondition.test(context, best);
    }

    public AlignmentStrategy getStrategy() { return strategy; }

    /**
     * 前置条件的文字描述，用于日志与接口展示
     */
    public String getCondition() { return condition; }

    public boolean isInvertOffset() { return invertOffset; }
}
