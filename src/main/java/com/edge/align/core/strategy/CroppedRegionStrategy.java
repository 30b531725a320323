package com.edge.align.core.strategy;

import com.edge.align.core.engine.ArtifactScope;
import com.edge.align.core.engine.ImageEngine;
import com.edge.align.core.engine.ImageEngineException;
import com.edge.align.core.engine.ImageHandle;
import com.edge.align.core.engine.TemplateMatch;
import com.edge.align.core.model.ImageSize;
import com.edge.align.core.model.Offset;
import com.edge.align.core.model.StrategyId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 中心裁剪区域比对
 * <p>
 * 对每个候选尺寸，从两张图中心各裁一块同尺寸区域计算 RMSE，
 * 取得分最低的尺寸，位移为两块裁剪区域左上角之差（目标 - 参考）。
 * 候选尺寸超出任一图像时跳过；单个尺寸失败不影响后续尺寸
 */
public class CroppedRegionStrategy implements AlignmentStrategy {
    private static final Logger logger = LoggerFactory.getLogger(CroppedRegionStrategy.class);

    @Override
    public StrategyId id() {
        return StrategyId.CROPPED_REGION;
    }

    @Override
    public Optional<StrategyResult> align(AlignmentContext context) {
        ImageEngine engine = context.getEngine();
        ImageSize refSize = context.getReferenceSize();
        ImageSize tgtSize = context.getTargetSize();

        StrategyResult best = null;
        for (ImageSize crop : context.getSettings().getCropSizes()) {
            if (!crop.fitsWithin(refSize) || !crop.fitsWithin(tgtSize)) {
                logger.debug("[{}] Crop {} skipped: larger than ref {} or target {}",
                    context.getCallId(), crop, refSize, tgtSize);
                continue;
            }

            int refX = (refSize.getWidth() - crop.getWidth()) / 2;
            int refY = (refSize.getHeight() - crop.getHeight()) / 2;
            int tgtX = (tgtSize.getWidth() - crop.getWidth()) / 2;
            int tgtY = (tgtSize.getHeight() - crop.getHeight()) / 2;

            // 每个尺寸一个作用域，continue / 异常时同样释放裁剪图
            try (ArtifactScope scope = context.openScope(id().getKey() + "-" + crop)) {
                ImageHandle refCrop = scope.track(engine.crop(context.getReference(),
                    refX, refY, crop.getWidth(), crop.getHeight()), "ref-crop");
                ImageHandle tgtCrop = scope.track(engine.crop(context.getTarget(),
                    tgtX, tgtY, crop.getWidth(), crop.getHeight()), "target-crop");

                TemplateMatch match = engine.templateMatch(refCrop, tgtCrop);
                Offset offset = new Offset(tgtX - refX, tgtY - refY);
                logger.debug("[{}] Crop {} score={}, offset={}", context.getCallId(), crop,
                    String.format("%.2f", match.getScore()), offset);

                if (best == null || match.getScore() < best.getScore()) {
                    best = new StrategyResult(match.getScore(), offset, id());
                }
            } catch (ImageEngineException e) {
                logger.debug("[{}] Crop {} failed: {}", context.getCallId(), crop, e.getMessage());
            }
        }
        return Optional.ofNullable(best);
    }
}
