package com.edge.align.core.strategy;

import com.edge.align.core.AlignmentSettings;
import com.edge.align.core.engine.ArtifactScope;
import com.edge.align.core.engine.DescriptorMatch;
import com.edge.align.core.engine.FeatureSet;
import com.edge.align.core.engine.ImageEngine;
import com.edge.align.core.model.AlignmentOptions;
import com.edge.align.core.model.HomographyMatrix;
import com.edge.align.core.model.Point;
import com.edge.align.core.model.StrategyId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 特征点单应性匹配（仅 opencv 模式）
 * <p>
 * 流程：
 * 1. 两图提取特征点与描述子（ORB / AKAZE / BRISK）
 * 2. 交叉验证最近邻匹配，按距离排序后保留前 matchFraction 比例
 * 3. 好匹配少于 minCorrespondences 时直接失败，不估计单应性
 * 4. RANSAC 估计 目标图 -> 参考图 的单应性矩阵
 * 5. 重投影误差小于 inlierThreshold 的匹配计为内点，置信度 = 内点数 / 好匹配数
 */
public class FeatureHomographyStrategy implements AlignmentStrategy {
    private static final Logger logger = LoggerFactory.getLogger(FeatureHomographyStrategy.class);

    @Override
    public StrategyId id() {
        return StrategyId.FEATURE_HOMOGRAPHY;
    }

    /**
     * 置信度超过阈值时给出候选，得分为 1 - 置信度
     */
    @Override
    public Optional<StrategyResult> align(AlignmentContext context) {
        double minConfidence = context.getSettings().getFeatureConfidence();
        return match(context)
            .filter(m -> m.getConfidence() > minConfidence)
            .map(m -> new StrategyResult(1.0 - m.getConfidence(), m.getTransform().toOffset(), id()));
    }

    /**
     * 执行特征匹配，不做置信度过滤
     */
    public Optional<FeatureMatchResult> match(AlignmentContext context) {
        ImageEngine engine = context.getEngine();
        AlignmentSettings settings = context.getSettings();
        AlignmentOptions options = context.getOptions();

        int maxFeatures = options.getMaxFeatures() != null ? options.getMaxFeatures() : settings.getMaxFeatures();
        double fraction = options.getThreshold() != null ? options.getThreshold() : settings.getMatchFraction();

        try (ArtifactScope scope = context.openScope(id().getKey())) {
            FeatureSet refFeatures = scope.track(
                engine.detectAndCompute(context.getReference(), options.getOpencvDetector(), maxFeatures));
            FeatureSet tgtFeatures = scope.track(
                engine.detectAndCompute(context.getTarget(), options.getOpencvDetector(), maxFeatures));

            logger.debug("[{}] {} keypoints: ref={}, target={}", context.getCallId(),
                options.getOpencvDetector(), refFeatures.size(), tgtFeatures.size());

            if (refFeatures.isEmpty() || tgtFeatures.isEmpty()) {
                logger.debug("[{}] No descriptors in one of the images", context.getCallId());
                return Optional.empty();
            }

            List<DescriptorMatch> matches = new ArrayList<>(engine.matchDescriptors(refFeatures, tgtFeatures));
            matches.sort(Comparator.comparingDouble(DescriptorMatch::getDistance));
            // 容忍浮点误差，如 20 * 0.7
            int keep = (int) Math.floor(matches.size() * fraction + 1e-9);
            List<DescriptorMatch> good = matches.subList(0, keep);

            if (good.size() < settings.getMinCorrespondences()) {
                logger.debug("[{}] Only {} good matches (of {}), need {}", context.getCallId(),
                    good.size(), matches.size(), settings.getMinCorrespondences());
                return Optional.empty();
            }

            List<Point> targetPoints = new ArrayList<>(good.size());
            List<Point> referencePoints = new ArrayList<>(good.size());
            for (DescriptorMatch m : good) {
                referencePoints.add(refFeatures.pointAt(m.getQueryIdx()));
                targetPoints.add(tgtFeatures.pointAt(m.getTrainIdx()));
            }

            Optional<HomographyMatrix> homography =
                engine.estimateHomography(targetPoints, referencePoints, settings.getRansacThreshold());
            if (homography.isEmpty()) {
                logger.debug("[{}] Homography estimation failed", context.getCallId());
                return Optional.empty();
            }

            int inliers = countInliers(homography.get(), targetPoints, referencePoints,
                settings.getInlierThreshold());
            FeatureMatchResult result = new FeatureMatchResult(homography.get(), inliers, good.size());
            logger.debug("[{}] {}", context.getCallId(), result);
            return Optional.of(result);
        }
    }

    static int countInliers(HomographyMatrix h, List<Point> src, List<Point> dst, double threshold) {
        int inliers = 0;
        for (int i = 0; i < src.size(); i++) {
            Point projected = h.project(src.get(i));
            if (projected != null && projected.distanceTo(dst.get(i)) < threshold) {
                inliers++;
            }
        }
        return inliers;
    }
}
