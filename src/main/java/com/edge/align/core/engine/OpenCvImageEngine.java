package com.edge.align.core.engine;

import com.edge.align.config.NativeLibraryLoader;
import com.edge.align.core.model.FeatureDetectorKind;
import com.edge.align.core.model.HomographyMatrix;
import com.edge.align.core.model.ImageSize;
import com.edge.align.core.model.Point;
import org.opencv.calib3d.Calib3d;
import org.opencv.core.*;
import org.opencv.features2d.AKAZE;
import org.opencv.features2d.BFMatcher;
import org.opencv.features2d.BRISK;
import org.opencv.features2d.Feature2D;
import org.opencv.features2d.ORB;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * 基于 OpenCV 的图像引擎实现
 * <p>
 * 无共享可变状态，可被多个对齐任务并发调用
 */
public class OpenCvImageEngine implements ImageEngine {
    private static final Logger logger = LoggerFactory.getLogger(OpenCvImageEngine.class);

    /**
     * 8 位 RMSE 换算到 16 位量化单位（65535 / 255）
     */
    public static final double QUANTUM_SCALE = 257.0;

    // 灰度填充背景色（白）
    private static final double PAD_BACKGROUND = 255.0;

    private final double cannyLow;
    private final double cannyHigh;

    public OpenCvImageEngine() {
        this(50, 150);
    }

    public OpenCvImageEngine(double cannyLow, double cannyHigh) {
        NativeLibraryLoader.loadNativeLibraries();
        this.cannyLow = cannyLow;
        this.cannyHigh = cannyHigh;
    }

    @Override
    public ImageSize decodeSize(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ImageEngineException("Image file not found: " + path);
        }

        // 优先只读文件头
        try (ImageInputStream in = ImageIO.createImageInputStream(path.toFile())) {
            if (in != null) {
                Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
                if (readers.hasNext()) {
                    ImageReader reader = readers.next();
                    try {
                        reader.setInput(in);
                        return new ImageSize(reader.getWidth(0), reader.getHeight(0));
                    } finally {
                        reader.dispose();
                    }
                }
            }
        } catch (IOException e) {
            logger.debug("ImageIO could not read header of {}: {}", path, e.getMessage());
        }

        // ImageIO 不支持的格式回退到完整解码
        try (ImageHandle image = load(path)) {
            return image.size();
        }
    }

    @Override
    public ImageHandle load(Path path) {
        Mat mat = Imgcodecs.imread(path.toString(), Imgcodecs.IMREAD_COLOR);
        if (mat.empty()) {
            mat.release();
            throw new ImageEngineException("Failed to decode image: " + path);
        }
        return new MatImageHandle(mat);
    }

    @Override
    public void write(ImageHandle image, Path path) {
        boolean ok;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            ok = Imgcodecs.imwrite(path.toString(), mat(image));
        } catch (IOException | CvException e) {
            throw new ImageEngineException("Failed to write image: " + path, e);
        }
        if (!ok) {
            throw new ImageEngineException("Failed to write image: " + path);
        }
    }

    @Override
    public TemplateMatch templateMatch(ImageHandle haystack, ImageHandle needle) {
        Mat big = mat(haystack);
        Mat small = mat(needle);

        if (big.empty() || small.empty()) {
            throw new ImageEngineException("Template match on empty image");
        }
        if (small.cols() > big.cols() || small.rows() > big.rows()) {
            throw new ImageEngineException(String.format("Needle %dx%d larger than haystack %dx%d",
                small.cols(), small.rows(), big.cols(), big.rows()));
        }
        if (small.type() != big.type()) {
            throw new ImageEngineException("Template match on images of different type");
        }

        Mat result = new Mat();
        try {
            Imgproc.matchTemplate(big, small, result, Imgproc.TM_SQDIFF);
            Core.MinMaxLocResult mm = Core.minMaxLoc(result);

            double samples = (double) small.cols() * small.rows() * small.channels();
            double mse = Math.max(0.0, mm.minVal) / samples;
            double score = Math.sqrt(mse) * QUANTUM_SCALE;
            if (Double.isNaN(score) || Double.isInfinite(score)) {
                throw new ImageEngineException("Template match produced no usable score");
            }
            return new TemplateMatch(score, (int) mm.minLoc.x, (int) mm.minLoc.y);
        } catch (CvException e) {
            throw new ImageEngineException("Template match failed: " + e.getMessage(), e);
        } finally {
            result.release();
        }
    }

    @Override
    public ImageHandle edgeDetect(ImageHandle image) {
        Mat gray = toGray(mat(image));
        Mat edges = new Mat();
        try {
            Imgproc.Canny(gray, edges, cannyLow, cannyHigh);
            // 反色：浅底深边
            Core.bitwise_not(edges, edges);
            return new MatImageHandle(edges);
        } catch (CvException e) {
            edges.release();
            throw new ImageEngineException("Edge detection failed: " + e.getMessage(), e);
        } finally {
            gray.release();
        }
    }

    @Override
    public ImageHandle resize(ImageHandle image, double percent) {
        if (percent <= 0) {
            throw new ImageEngineException("Resize percent must be positive: " + percent);
        }
        Mat src = mat(image);
        int w = Math.max(1, (int) Math.round(src.cols() * percent / 100.0));
        int h = Math.max(1, (int) Math.round(src.rows() * percent / 100.0));

        Mat dst = new Mat();
        int interpolation = percent < 100 ? Imgproc.INTER_AREA : Imgproc.INTER_LINEAR;
        try {
            Imgproc.resize(src, dst, new Size(w, h), 0, 0, interpolation);
            return new MatImageHandle(dst);
        } catch (CvException e) {
            dst.release();
            throw new ImageEngineException("Resize to " + percent + "% failed: " + e.getMessage(), e);
        }
    }

    @Override
    public ImageHandle crop(ImageHandle image, int x, int y, int width, int height) {
        Mat src = mat(image);
        if (x < 0 || y < 0 || width <= 0 || height <= 0
            || x + width > src.cols() || y + height > src.rows()) {
            throw new ImageEngineException(String.format("Crop %dx%d+%d+%d outside image %dx%d",
                width, height, x, y, src.cols(), src.rows()));
        }
        Mat roi = new Mat(src, new Rect(x, y, width, height));
        Mat copy = roi.clone();
        roi.release();
        return new MatImageHandle(copy);
    }

    @Override
    public ImageHandle composite(ImageSize canvasSize, ImageHandle image, int offsetX, int offsetY,
                                 boolean transparentBackground) {
        Mat src = mat(image);
        Mat content = transparentBackground ? toBgra(src) : src;
        Mat canvas = transparentBackground
            ? new Mat(canvasSize.getHeight(), canvasSize.getWidth(), CvType.CV_8UC4, new Scalar(0, 0, 0, 0))
            : Mat.zeros(canvasSize.getHeight(), canvasSize.getWidth(), src.type());

        try {
            int x0 = Math.max(0, offsetX);
            int y0 = Math.max(0, offsetY);
            int x1 = Math.min(canvasSize.getWidth(), offsetX + src.cols());
            int y1 = Math.min(canvasSize.getHeight(), offsetY + src.rows());

            if (x1 > x0 && y1 > y0) {
                Mat from = new Mat(content, new Rect(x0 - offsetX, y0 - offsetY, x1 - x0, y1 - y0));
                Mat to = new Mat(canvas, new Rect(x0, y0, x1 - x0, y1 - y0));
                from.copyTo(to);
                from.release();
                to.release();
            }
            return new MatImageHandle(canvas);
        } catch (CvException e) {
            canvas.release();
            throw new ImageEngineException("Composite failed: " + e.getMessage(), e);
        } finally {
            if (content != src) {
                content.release();
            }
        }
    }

    @Override
    public ImageHandle grayscaleAndPad(ImageHandle image, ImageSize targetSize) {
        Mat gray = toGray(mat(image));
        int bottom = Math.max(0, targetSize.getHeight() - gray.rows());
        int right = Math.max(0, targetSize.getWidth() - gray.cols());
        if (bottom == 0 && right == 0) {
            return new MatImageHandle(gray);
        }

        Mat padded = new Mat();
        try {
            Core.copyMakeBorder(gray, padded, 0, bottom, 0, right, Core.BORDER_CONSTANT, new Scalar(PAD_BACKGROUND));
            return new MatImageHandle(padded);
        } finally {
            gray.release();
        }
    }

    @Override
    public double normalizedCrossCorrelation(ImageHandle a, ImageHandle b) {
        Mat first = mat(a);
        Mat second = mat(b);
        if (first.cols() != second.cols() || first.rows() != second.rows()) {
            throw new ImageEngineException("Cross-correlation requires images of equal size");
        }

        Mat result = new Mat();
        try {
            // 减均值，否则大片白底会把相关性推到接近 1
            Imgproc.matchTemplate(first, second, result, Imgproc.TM_CCOEFF_NORMED);
            double value = result.get(0, 0)[0];
            if (Double.isNaN(value)) {
                throw new ImageEngineException("Cross-correlation is undefined for these images");
            }
            return Math.max(0.0, Math.min(1.0, value));
        } catch (CvException e) {
            throw new ImageEngineException("Cross-correlation failed: " + e.getMessage(), e);
        } finally {
            result.release();
        }
    }

    @Override
    public FeatureSet detectAndCompute(ImageHandle image, FeatureDetectorKind kind, int maxFeatures) {
        Mat gray = toGray(mat(image));
        MatOfKeyPoint keypoints = new MatOfKeyPoint();
        Mat descriptors = new Mat();
        Mat mask = new Mat();
        try {
            Feature2D detector = createDetector(kind, maxFeatures);
            detector.detectAndCompute(gray, mask, keypoints, descriptors);

            List<Point> points = new ArrayList<>();
            for (KeyPoint kp : keypoints.toList()) {
                points.add(new Point(kp.pt.x, kp.pt.y));
            }
            return new FeatureSet(points, new MatImageHandle(descriptors));
        } catch (CvException e) {
            descriptors.release();
            throw new ImageEngineException("Feature detection failed: " + e.getMessage(), e);
        } finally {
            gray.release();
            keypoints.release();
            mask.release();
        }
    }

    @Override
    public List<DescriptorMatch> matchDescriptors(FeatureSet reference, FeatureSet target) {
        List<DescriptorMatch> result = new ArrayList<>();
        if (reference.isEmpty() || target.isEmpty()) {
            return result;
        }

        Mat query = mat(reference.getDescriptors());
        Mat train = mat(target.getDescriptors());
        MatOfDMatch matches = new MatOfDMatch();
        try {
            // ORB/AKAZE/BRISK 都是二进制描述子，用汉明距离暴力匹配
            BFMatcher matcher = BFMatcher.create(Core.NORM_HAMMING, true);
            matcher.match(query, train, matches);
            for (DMatch m : matches.toList()) {
                result.add(new DescriptorMatch(m.queryIdx, m.trainIdx, m.distance));
            }
            return result;
        } catch (CvException e) {
            throw new ImageEngineException("Descriptor matching failed: " + e.getMessage(), e);
        } finally {
            matches.release();
        }
    }

    @Override
    public Optional<HomographyMatrix> estimateHomography(List<Point> src, List<Point> dst, double ransacThreshold) {
        if (src.size() != dst.size() || src.size() < 4) {
            return Optional.empty();
        }

        MatOfPoint2f srcMat = toMatOfPoint2f(src);
        MatOfPoint2f dstMat = toMatOfPoint2f(dst);
        Mat h = null;
        try {
            h = Calib3d.findHomography(srcMat, dstMat, Calib3d.RANSAC, ransacThreshold);
            if (h == null || h.empty() || h.rows() != 3 || h.cols() != 3) {
                return Optional.empty();
            }
            double[][] values = new double[3][3];
            for (int r = 0; r < 3; r++) {
                for (int c = 0; c < 3; c++) {
                    values[r][c] = h.get(r, c)[0];
                }
            }
            return Optional.of(new HomographyMatrix(values));
        } catch (CvException e) {
            throw new ImageEngineException("Homography estimation failed: " + e.getMessage(), e);
        } finally {
            srcMat.release();
            dstMat.release();
            if (h != null) {
                h.release();
            }
        }
    }

    @Override
    public ImageHandle warpPerspective(ImageHandle image, HomographyMatrix homography, ImageSize canvasSize) {
        Mat bgra = toBgra(mat(image));
        Mat h = new Mat(3, 3, CvType.CV_64F);
        Mat warped = new Mat();
        try {
            for (int r = 0; r < 3; r++) {
                for (int c = 0; c < 3; c++) {
                    h.put(r, c, homography.get(r, c));
                }
            }
            Imgproc.warpPerspective(bgra, warped, h, new Size(canvasSize.getWidth(), canvasSize.getHeight()),
                Imgproc.INTER_LINEAR, Core.BORDER_CONSTANT, new Scalar(0, 0, 0, 0));
            return new MatImageHandle(warped);
        } catch (CvException e) {
            warped.release();
            throw new ImageEngineException("Perspective warp failed: " + e.getMessage(), e);
        } finally {
            bgra.release();
            h.release();
        }
    }

    // ========== 内部工具 ==========

    private Feature2D createDetector(FeatureDetectorKind kind, int maxFeatures) {
        switch (kind) {
            case AKAZE:
                return AKAZE.create();
            case BRISK:
                return BRISK.create();
            case ORB:
            default:
                return ORB.create(maxFeatures);
        }
    }

    private static Mat mat(ImageHandle handle) {
        if (!(handle instanceof MatImageHandle)) {
            throw new ImageEngineException("Unsupported image handle: " + handle);
        }
        return ((MatImageHandle) handle).mat();
    }

    /**
     * 转灰度，返回新 Mat
     */
    private static Mat toGray(Mat src) {
        Mat gray = new Mat();
        if (src.channels() == 3) {
            Imgproc.cvtColor(src, gray, Imgproc.COLOR_BGR2GRAY);
        } else if (src.channels() == 4) {
            Imgproc.cvtColor(src, gray, Imgproc.COLOR_BGRA2GRAY);
        } else {
            src.copyTo(gray);
        }
        return gray;
    }

    /**
     * 转 4 通道（不透明），返回新 Mat
     */
    private static Mat toBgra(Mat src) {
        Mat bgra = new Mat();
        if (src.channels() == 3) {
            Imgproc.cvtColor(src, bgra, Imgproc.COLOR_BGR2BGRA);
        } else if (src.channels() == 1) {
            Imgproc.cvtColor(src, bgra, Imgproc.COLOR_GRAY2BGRA);
        } else {
            src.copyTo(bgra);
        }
        return bgra;
    }

    private static MatOfPoint2f toMatOfPoint2f(List<Point> points) {
        List<org.opencv.core.Point> cvPoints = new ArrayList<>(points.size());
        for (Point p : points) {
            cvPoints.add(new org.opencv.core.Point(p.x, p.y));
        }
        MatOfPoint2f mat = new MatOfPoint2f();
        mat.fromList(cvPoints);
        return mat;
    }
}
