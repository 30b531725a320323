package com.edge.align.core.engine;

import com.edge.align.core.model.FeatureDetectorKind;
import com.edge.align.core.model.HomographyMatrix;
import com.edge.align.core.model.ImageSize;
import com.edge.align.core.model.Point;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 对齐引擎所依赖的图像处理能力
 * <p>
 * 所有返回 ImageHandle 的方法都会创建新图像，调用者负责关闭。
 * 失败时抛出 {@link ImageEngineException}
 */
public interface ImageEngine {

    /**
     * 只读取文件头获取尺寸
     */
    ImageSize decodeSize(Path path);

    /**
     * 解码为 3 通道彩色图
     */
    ImageHandle load(Path path);

    void write(ImageHandle image, Path path);

    /**
     * 在 haystack 中搜索 needle，RMSE 度量
     *
     * @return 最小得分及 needle 左上角在 haystack 中的位置
     */
    TemplateMatch templateMatch(ImageHandle haystack, ImageHandle needle);

    /**
     * 灰度边缘图，反色（浅底深边）
     */
    ImageHandle edgeDetect(ImageHandle image);

    ImageHandle resize(ImageHandle image, double percent);

    ImageHandle crop(ImageHandle image, int x, int y, int width, int height);

    /**
     * 把 image 放到 canvasSize 大小的画布上 (offsetX, offsetY) 处
     *
     * @param transparentBackground true 时输出带 alpha 通道，画布其余部分透明；
     *                              false 时保持 image 的通道数，其余部分填黑
     */
    ImageHandle composite(ImageSize canvasSize, ImageHandle image, int offsetX, int offsetY,
                          boolean transparentBackground);

    /**
     * 转灰度并向右下填充背景色到 targetSize
     */
    ImageHandle grayscaleAndPad(ImageHandle image, ImageSize targetSize);

    /**
     * 两张同尺寸图像的归一化互相关（先减均值），取值 [0, 1]，负相关按 0 计
     */
    double normalizedCrossCorrelation(ImageHandle a, ImageHandle b);

    // ========== 特征匹配能力 ==========

    FeatureSet detectAndCompute(ImageHandle image, FeatureDetectorKind kind, int maxFeatures);

    /**
     * 最近邻匹配（交叉验证），query 为 reference，train 为 target
     */
    List<DescriptorMatch> matchDescriptors(FeatureSet reference, FeatureSet target);

    /**
     * RANSAC 估计把 src 映射到 dst 的单应性矩阵，退化时返回 empty
     */
    Optional<HomographyMatrix> estimateHomography(List<Point> src, List<Point> dst, double ransacThreshold);

    /**
     * 透视变换到 canvasSize 画布，画布外区域透明
     */
    ImageHandle warpPerspective(ImageHandle image, HomographyMatrix homography, ImageSize canvasSize);
}
