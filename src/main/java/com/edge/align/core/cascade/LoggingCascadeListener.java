package com.edge.align.core.cascade;

import com.edge.align.core.model.StrategyId;
import com.edge.align.core.strategy.AlignmentContext;
import com.edge.align.core.strategy.StrategyResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 把级联事件写到 SLF4J
 */
public class LoggingCascadeListener implements CascadeListener {
    private static final Logger logger = LoggerFactory.getLogger(StrategyCascade.class);

    @Override
    public void onAttempt(AlignmentContext context, StrategyId strategy) {
        logger.debug("[{}] Trying {}", context.getCallId(), strategy.getKey());
    }

    @Override
    public void onSkip(AlignmentContext context, StrategyId strategy, String reason) {
        logger.debug("[{}] Skipping {}: {}", context.getCallId(), strategy.getKey(), reason);
    }

    @Override
    public void onCandidate(AlignmentContext context, StrategyResult candidate, boolean newBest) {
        logger.info("[{}] {} -> score={}, offset={}{}", context.getCallId(), candidate.getMethod().getKey(),
            String.format("%.2f", candidate.getScore()), candidate.getOffset(), newBest ? " (best)" : "");
    }

    @Override
    public void onNoCandidate(AlignmentContext context, StrategyId strategy, Throwable cause) {
        if (cause != null) {
            logger.warn("[{}] {} failed: {}", context.getCallId(), strategy.getKey(), cause.getMessage());
            logger.debug("[{}] {} failure detail", context.getCallId(), strategy.getKey(), cause);
        } else {
            logger.debug("[{}] {} produced no candidate", context.getCallId(), strategy.getKey());
        }
    }

    @Override
    public void onShortCircuit(AlignmentContext context, StrategyId strategy, double confidence) {
        logger.info("[{}] {} confidence {} above threshold, skipping remaining strategies",
            context.getCallId(), strategy.getKey(), String.format("%.3f", confidence));
    }

    @Override
    public void onFinish(AlignmentContext context, CascadeOutcome outcome, long elapsedMillis) {
        if (outcome.hasCandidate()) {
            logger.info("[{}] Alignment finished in {}ms: method={}, score={}, offset={}", context.getCallId(),
                elapsedMillis, outcome.getMethod().getKey(), String.format("%.2f", outcome.getScore()),
                outcome.getOffset());
        } else {
            logger.warn("[{}] No strategy produced a candidate in {}ms, using identity offset",
                context.getCallId(), elapsedMillis);
        }
    }
}
