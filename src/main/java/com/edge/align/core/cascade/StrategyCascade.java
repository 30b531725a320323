package com.edge.align.core.cascade;

import com.edge.align.core.model.AlignmentMethod;
import com.edge.align.core.model.StrategyId;
import com.edge.align.core.strategy.AlignmentContext;
import com.edge.align.core.strategy.AlignmentStrategy;
import com.edge.align.core.strategy.CroppedRegionStrategy;
import com.edge.align.core.strategy.DirectSubimageStrategy;
import com.edge.align.core.strategy.EdgeBasedStrategy;
import com.edge.align.core.strategy.FeatureHomographyStrategy;
import com.edge.align.core.strategy.FeatureMatchResult;
import com.edge.align.core.strategy.MultiScaleStrategy;
import com.edge.align.core.strategy.PhaseCorrelationStrategy;
import com.edge.align.core.strategy.ReverseSubimageStrategy;
import com.edge.align.core.strategy.StrategyResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 对齐策略级联控制器
 * <p>
 * 升级策略：
 * 1. opencv 模式先做特征匹配，置信度超过阈值直接返回（唯一允许跳过后续策略的情况）
 * 2. 便宜、精确的策略先执行（直接/反向子图搜索）
 * 3. 昂贵或精度较低的策略只在没有候选或当前得分较差时执行
 * <p>
 * 单个策略失败（异常或无结果）只记录，不中断级联。
 * 不同策略的得分量纲不同，这里直接比较，不做归一化
 */
public class StrategyCascade {

    private final FeatureHomographyStrategy featureStrategy;
    private final List<CascadeStep> steps;
    private final CascadeListener listener;

    public StrategyCascade(FeatureHomographyStrategy featureStrategy, List<CascadeStep> steps,
                           CascadeListener listener) {
        this.featureStrategy = featureStrategy;
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
        this.listener = listener != null ? listener : CascadeListener.NOOP;
    }

    /**
     * 标准级联顺序
     */
    public static StrategyCascade standard(CascadeListener listener) {
        return new StrategyCascade(new FeatureHomographyStrategy(), standardSteps(
            new DirectSubimageStrategy(),
            new ReverseSubimageStrategy(),
            new EdgeBasedStrategy(),
            new CroppedRegionStrategy(),
            new MultiScaleStrategy(),
            new PhaseCorrelationStrategy()), listener);
    }

    /**
     * 按标准前置条件组装步骤，阈值在执行时从上下文的配置读取
     */
    public static List<CascadeStep> standardSteps(AlignmentStrategy direct, AlignmentStrategy reverse,
                                                  AlignmentStrategy edge, AlignmentStrategy cropped,
                                                  AlignmentStrategy multiScale, AlignmentStrategy phase) {
        return Arrays.asList(
            new CascadeStep(direct, "target fits inside reference",
                (ctx, best) -> ctx.getTargetSize().fitsWithin(ctx.getReferenceSize())),
            new CascadeStep(reverse, "reference fits inside target",
                (ctx, best) -> ctx.getReferenceSize().fitsWithin(ctx.getTargetSize()), true),
            new CascadeStep(edge, "no candidate or score > edge-threshold",
                (ctx, best) -> best.worseThan(ctx.getSettings().getEdgeThreshold())),
            new CascadeStep(cropped, "no candidate or score > crop-threshold",
                (ctx, best) -> best.worseThan(ctx.getSettings().getCropThreshold())),
            new CascadeStep(multiScale, "no candidate or score > multi-scale-threshold",
                (ctx, best) -> best.worseThan(ctx.getSettings().getMultiScaleThreshold())),
            new CascadeStep(phase, "method is phase or no candidate",
                (ctx, best) -> ctx.getOptions().getMethod() == AlignmentMethod.PHASE || !best.hasCandidate())
        );
    }

    public List<CascadeStep> getSteps() {
        return steps;
    }

    public CascadeOutcome run(AlignmentContext context) {
        long start = System.currentTimeMillis();
        List<StrategyId> attempted = new ArrayList<>();

        if (context.getOptions().getMethod() == AlignmentMethod.OPENCV && featureStrategy != null) {
            CascadeOutcome shortCircuit = tryFeatures(context, attempted);
            if (shortCircuit != null) {
                listener.onFinish(context, shortCircuit, System.currentTimeMillis() - start);
                return shortCircuit;
            }
        }

        BestMatch best = new BestMatch();
        for (CascadeStep step : steps) {
            StrategyId id = step.getStrategy().id();
            if (!step.isEligible(context, best)) {
                listener.onSkip(context, id, "precondition not met: " + step.getCondition());
                continue;
            }

            listener.onAttempt(context, id);
            attempted.add(id);
            Optional<StrategyResult> result;
            try {
                result = step.getStrategy().align(context);
            } catch (RuntimeException e) {
                listener.onNoCandidate(context, id, e);
                continue;
            }

            if (result.isEmpty()) {
                listener.onNoCandidate(context, id, null);
                continue;
            }

            StrategyResult candidate = result.get();
            if (step.isInvertOffset()) {
                candidate = candidate.withOffset(candidate.getOffset().negate());
            }
            boolean improved = best.offer(candidate);
            listener.onCandidate(context, candidate, improved);
        }

        CascadeOutcome outcome = CascadeOutcome.of(best, attempted);
        listener.onFinish(context, outcome, System.currentTimeMillis() - start);
        return outcome;
    }

    /**
     * 特征匹配短路；置信度不足或失败时返回 null，继续常规级联
     */
    private CascadeOutcome tryFeatures(AlignmentContext context, List<StrategyId> attempted) {
        StrategyId id = featureStrategy.id();
        listener.onAttempt(context, id);
        attempted.add(id);

        Optional<FeatureMatchResult> match;
        try {
            match = featureStrategy.match(context);
        } catch (RuntimeException e) {
            listener.onNoCandidate(context, id, e);
            return null;
        }
        if (match.isEmpty()) {
            listener.onNoCandidate(context, id, null);
            return null;
        }

        FeatureMatchResult m = match.get();
        if (m.getConfidence() <= context.getSettings().getFeatureConfidence()) {
            listener.onSkip(context, id, String.format("confidence %.3f not above %.3f",
                m.getConfidence(), context.getSettings().getFeatureConfidence()));
            return null;
        }

        listener.onShortCircuit(context, id, m.getConfidence());
        return new CascadeOutcome(id, 1.0 - m.getConfidence(), m.getTransform().toOffset(),
            m.getHomography(), attempted);
    }
}
