package com.edge.align.core.cascade;

import com.edge.align.core.model.HomographyMatrix;
import com.edge.align.core.model.HomographyTransform;
import com.edge.align.core.model.Offset;
import com.edge.align.core.model.StrategyId;

import java.util.Collections;
import java.util.List;

/**
 * 级联结果
 * <p>
 * 没有任何候选时 method 为 NONE、位移为 (0, 0)，这是已知的最坏情况而不是错误。
 * homography 仅在特征匹配短路返回时存在
 */
public class CascadeOutcome {
    private final StrategyId method;
    private final double score;
    private final Offset offset;
    private final HomographyMatrix homography;
    private final List<StrategyId> attempted;

    public CascadeOutcome(StrategyId method, double score, Offset offset,
                          HomographyMatrix homography, List<StrategyId> attempted) {
        this.method = method;
        this.score = score;
        this.offset = offset;
        this.homography = homography;
        this.attempted = Collections.unmodifiableList(attempted);
    }

    static CascadeOutcome of(BestMatch best, List<StrategyId> attempted) {
        return new CascadeOutcome(best.getMethod(), best.getScore(), best.getOffset(), null, attempted);
    }

    public StrategyId getMethod() { return method; }
    public double getScore() { return score; }
    public Offset getOffset() { return offset; }
    public HomographyMatrix getHomography() { return homography; }
    public List<StrategyId> getAttempted() { return attempted; }

    public boolean hasCandidate() {
        return method != StrategyId.NONE;
    }

    public HomographyTransform getTransform() {
        return homography != null ? homography.decompose() : null;
    }

    @Override
    public String toString() {
        return String.format("CascadeOutcome{method=%s, score=%.2f, offset=%s, attempted=%s}",
            method.getKey(), score, offset, attempted);
    }
}
