package com.edge.align.core.strategy;

import com.edge.align.core.engine.ImageEngine;
import com.edge.align.core.engine.ImageHandle;
import com.edge.align.core.engine.TemplateMatch;
import com.edge.align.core.model.Offset;
import com.edge.align.core.model.StrategyId;

import java.util.Optional;

/**
 * 子图搜索，供直接/反向搜索以及边缘图、多尺度策略复用
 */
final class SubimageSearch {

    private SubimageSearch() {
    }

    /**
     * 目标图在参考图中的位置，即目标图需要的位移
     */
    static Optional<StrategyResult> targetInReference(ImageEngine engine, ImageHandle reference,
                                                      ImageHandle target, StrategyId method) {
        if (!target.size().fitsWithin(reference.size())) {
            return Optional.empty();
        }
        TemplateMatch match = engine.templateMatch(reference, target);
        return Optional.of(new StrategyResult(match.getScore(),
            new Offset(match.getOffsetX(), match.getOffsetY()), method));
    }

    /**
     * 参考图在目标图中的位置（未取反的搜索原始位置）
     */
    static Optional<StrategyResult> referenceInTarget(ImageEngine engine, ImageHandle reference,
                                                      ImageHandle target, StrategyId method) {
        if (!reference.size().fitsWithin(target.size())) {
            return Optional.empty();
        }
        TemplateMatch match = engine.templateMatch(target, reference);
        return Optional.of(new StrategyResult(match.getScore(),
            new Offset(match.getOffsetX(), match.getOffsetY()), method));
    }

    /**
     * 先直接搜索，失败后反向搜索；反向结果已取反，符合目标图位移的符号约定
     */
    static Optional<StrategyResult> eitherDirection(ImageEngine engine, ImageHandle reference,
                                                    ImageHandle target, StrategyId method) {
        Optional<StrategyResult> direct = Optional.empty();
        RuntimeException directFailure = null;
        try {
            direct = targetInReference(engine, reference, target, method);
        } catch (RuntimeException e) {
            directFailure = e;
        }
        if (direct.isPresent()) {
            return direct;
        }

        Optional<StrategyResult> reverse = referenceInTarget(engine, reference, target, method);
        if (reverse.isEmpty() && directFailure != null) {
            throw directFailure;
        }
        return reverse.map(r -> r.withOffset(r.getOffset().negate()));
    }
}
