package com.edge.align.core.strategy;

import com.edge.align.core.model.Offset;
import com.edge.align.core.model.StrategyId;

/**
 * 策略给出的候选结果
 * <p>
 * 得分越低越好；不同策略的得分量纲不同，不做归一化
 */
public class StrategyResult {
    private final double score;
    private final Offset offset;
    private final StrategyId method;

    public StrategyResult(double score, Offset offset, StrategyId method) {
        if (Double.isNaN(score) || score < 0) {
            throw new IllegalArgumentException("Score must be a non-negative number, got " + score);
        }
        this.score = score;
        this.offset = offset;
        this.method = method;
    }

    public double getScore() { return score; }
    public Offset getOffset() { return offset; }
    public StrategyId getMethod() { return method; }

    public StrategyResult withOffset(Offset newOffset) {
        return new StrategyResult(score, newOffset, method);
    }

    public StrategyResult withMethod(StrategyId newMethod) {
        return new StrategyResult(score, offset, newMethod);
    }

    @Override
    public String toString() {
        return String.format("%s{score=%.2f, offset=%s}", method.getKey(), score, offset);
    }
}
