package com.edge.align.core.cascade;

import com.edge.align.core.model.Offset;
import com.edge.align.core.model.StrategyId;
import com.edge.align.core.strategy.StrategyResult;

/**
 * 级联过程中得分最低的候选
 * <p>
 * 初始为 {score=+∞, offset=(0,0), method=none}；只有严格更低的得分才会替换，
 * 得分相同时保留先执行（更便宜）的策略结果
 */
public class BestMatch {
    private double score = Double.POSITIVE_INFINITY;
    private Offset offset = Offset.ZERO;
    private StrategyId method = StrategyId.NONE;

    /**
     * @return 是否替换了当前最优
     */
    public boolean offer(StrategyResult candidate) {
        if (candidate.getScore() < score) {
            score = candidate.getScore();
            offset = candidate.getOffset();
            method = candidate.getMethod();
            return true;
        }
        return false;
    }

    public boolean hasCandidate() {
        return method != StrategyId.NONE;
    }

    /**
     * 没有候选或当前得分高于阈值
     */
    public boolean worseThan(double threshold) {
        return !hasCandidate() || score > threshold;
    }

    public double getScore() { return score; }
    public Offset getOffset() { return offset; }
    public StrategyId getMethod() { return method; }

    @Override
    public String toString() {
        return String.format("BestMatch{method=%s, score=%.2f, offset=%s}", method.getKey(), score, offset);
    }
}
