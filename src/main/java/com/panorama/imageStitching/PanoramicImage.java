package com.panorama.imageStitching;

import com.panorama.imageStitching.blender.ImageCompositor;
import com.panorama.imageStitching.exception.PanoramaConfigurationException;
import com.panorama.imageStitching.exception.PanoramaException;
import com.panorama.imageStitching.feature.FeatureExtractor;
import com.panorama.imageStitching.feature.FeatureSet;
import com.panorama.imageStitching.matchAndTransform.CanvasExtent;
import com.panorama.imageStitching.matchAndTransform.CorrespondenceMatcher;
import com.panorama.imageStitching.matchAndTransform.ShiftAccumulator;
import com.panorama.imageStitching.matchAndTransform.ShiftEstimate;
import com.panorama.imageStitching.warper.CylindricalWarper;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.opencv_core.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.IntFunction;

import static org.bytedeco.opencv.global.opencv_core.*;
import static org.bytedeco.opencv.global.opencv_features2d.NOT_DRAW_SINGLE_POINTS;
import static org.bytedeco.opencv.global.opencv_features2d.drawMatches;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * Panorama of an ordered image sequence taken by a camera rotating about one axis.
 * <p>
 * Shifts are computed once, on the non-equalized grayscale projections, and shared by
 * the four variants (grayscale x equalized). Every variant is built lazily on the first
 * {@link #get(boolean, boolean, boolean)} that asks for it and returned as-is afterwards;
 * callers must not modify the returned images.
 * <p>
 * All public methods share one lock.
 */
@Slf4j
public class PanoramicImage {
    private static final Executor CALLER_THREAD = Runnable::run;

    private final List<Mat> originalImages;
    private final double halfFovRad;
    private final FeatureExtractor extractor;
    private final CorrespondenceMatcher matcher;
    private final Executor executor;

    private List<Mat> projectedImages;
    private List<Mat> projectedGray;
    private List<Mat> bgrEqualized;
    private List<Mat> grayEqualized;

    // Chỉ cần tính một lần vì luôn match trên ảnh xám chưa cân bằng
    private List<ShiftEstimate> shifts;
    private CanvasExtent extent;

    // Trục 0: ảnh xám, trục 1: cân bằng histogram
    private final Mat[][] results = new Mat[2][2];

    private final List<Mat> matchImages = new ArrayList<>();

    private int shiftComputations;
    private int compositions;

    public PanoramicImage(List<Mat> images, StitchingOptions options) {
        this(images, options, CALLER_THREAD);
    }

    /**
     * @param images   Images sorted in {@code options.getDirection()} order
     * @param options  Field of view, matching tunables and detector
     * @param executor Runs per-image projection and detection and per-pair matching
     */
    public PanoramicImage(List<Mat> images, StitchingOptions options, Executor executor) {
        if (images == null || images.size() < 2) {
            throw new PanoramaConfigurationException("At least 2 images are needed, got " + (images == null ? 0 : images.size()));
        }
        for (int i = 0; i < images.size(); i++) {
            Mat image = images.get(i);
            if (image == null || image.empty()) {
                throw new PanoramaConfigurationException("Image " + i + " is empty");
            }
            if (image.channels() != 3) {
                throw new PanoramaConfigurationException("Image " + i + " has " + image.channels() + " channels, expected 3");
            }
        }
        double halfFov = options.getHalfFovDegrees();
        if (!(halfFov > 0) || halfFov >= 90) {
            throw new PanoramaConfigurationException("Half field of view must be in (0, 90) degrees, got " + halfFov);
        }
        if (!(options.getDistRatio() > 0)) {
            throw new PanoramaConfigurationException("Distance ratio must be positive, got " + options.getDistRatio());
        }
        if (options.getExtractor() == null) {
            throw new PanoramaConfigurationException("No feature extractor selected");
        }

        this.originalImages = new ArrayList<>(images);
        // Ảnh chụp từ phải sang trái thì đảo lại thứ tự
        if (options.getDirection() == Direction.LEFT) {
            Collections.reverse(this.originalImages);
        }
        this.halfFovRad = Math.toRadians(halfFov);
        this.extractor = options.getExtractor();
        this.matcher = new CorrespondenceMatcher(options.getDistRatio(), options.getRansacThreshold(), options.getMinInliers());
        this.executor = executor == null ? CALLER_THREAD : executor;
    }

    /**
     * @param gray     Build the panorama from grayscale images
     * @param equalize Build it from histogram-equalized images
     * @param draw     Also draw the inlier matches, see {@link #matchImages()}
     * @return The panorama for the requested variant, computed on first request only
     */
    public synchronized Mat get(boolean gray, boolean equalize, boolean draw) {
        int grayIdx = gray ? 1 : 0;
        int equalIdx = equalize ? 1 : 0;
        boolean shouldDraw = draw && matchImages.isEmpty();

        Mat result = results[grayIdx][equalIdx];
        if (result != null && !shouldDraw) return result;

        // Chỉ tính lại shift khi cần vẽ mà chưa vẽ lần nào
        if (shifts == null || shouldDraw) {
            prepareShifts(shouldDraw);
        }
        if (result != null) return result;

        List<Mat> materials = materials(gray, equalize);
        log.info("Compositing {}{} panorama from {} images", gray ? "grayscale" : "color",
                equalize ? " equalized" : "", materials.size());
        result = ImageCompositor.compose(materials, shifts, extent);
        results[grayIdx][equalIdx] = result;
        compositions++;
        return result;
    }

    /**
     * @return The 4 variants in order: color, color equalized, grayscale, grayscale equalized.
     * Grayscale ones are converted to BGR.
     */
    public synchronized List<Mat> getAll(boolean draw) {
        List<Mat> all = new ArrayList<>(4);
        all.add(get(false, false, draw));
        all.add(get(false, true, draw));
        all.add(toBgr(get(true, false, draw)));
        all.add(toBgr(get(true, true, draw)));
        return all;
    }

    /**
     * @return One image per adjacent pair with its inlier matches drawn. Empty until
     * {@code get} or {@code getAll} ran with {@code draw = true}.
     */
    public synchronized List<Mat> matchImages() {
        return Collections.unmodifiableList(new ArrayList<>(matchImages));
    }

    public synchronized List<ShiftEstimate> getShifts() {
        return shifts == null ? Collections.emptyList() : Collections.unmodifiableList(shifts);
    }

    public synchronized CanvasExtent getExtent() {
        return extent;
    }

    public synchronized int getShiftComputations() {
        return shiftComputations;
    }

    public synchronized int getCompositions() {
        return compositions;
    }

    private void projectImages() {
        int n = originalImages.size();
        Size size = originalImages.get(0).size();
        log.info("Projecting {} images on a cylinder (half fov {} rad)", n, halfFovRad);

        List<Mat[]> projected = runAll(n, i -> {
            Mat source = originalImages.get(i);
            if (source.cols() != size.width() || source.rows() != size.height()) {
                log.warn("Image {} is {}x{}, resizing to {}x{}", i, source.cols(), source.rows(), size.width(), size.height());
                Mat resized = new Mat();
                resize(source, resized, size);
                source = resized;
            }
            Mat color = CylindricalWarper.warp(source, halfFovRad);
            Mat gray = new Mat();
            cvtColor(color, gray, COLOR_BGR2GRAY);
            return new Mat[]{color, gray};
        });

        projectedImages = new ArrayList<>(n);
        projectedGray = new ArrayList<>(n);
        for (Mat[] pair : projected) {
            projectedImages.add(pair[0]);
            projectedGray.add(pair[1]);
        }
    }

    /**
     * Features, matches and shifts. Drawing is the only reason to run it twice.
     */
    private void prepareShifts(boolean draw) {
        if (projectedImages == null) projectImages();
        int n = projectedGray.size();

        log.info("Detecting features with {}", extractor);
        List<FeatureSet> features = runAll(n, i -> extractor.detect(projectedGray.get(i)));

        log.info("Matching {} adjacent pairs", n - 1);
        List<ShiftEstimate> pairShifts = runAll(n - 1, i -> matcher.estimate(i, features.get(i), features.get(i + 1)));

        shifts = pairShifts;
        extent = ShiftAccumulator.accumulate(pairShifts);
        shiftComputations++;
        log.info("Shifts {}, extent {}", pairShifts, extent);

        if (draw) {
            matchImages.clear();
            for (int i = 0; i < n - 1; i++) {
                matchImages.add(drawInliers(projectedGray.get(i), features.get(i),
                        projectedGray.get(i + 1), features.get(i + 1), pairShifts.get(i).getInlierMatches()));
            }
        }
    }

    /**
     * Side-by-side images joined by their inlier matches. Keypoints without a match are not drawn.
     */
    static Mat drawInliers(Mat left, FeatureSet leftFeatures, Mat right, FeatureSet rightFeatures, List<DMatch> inliers) {
        Mat out = new Mat();
        DMatchVector matches = new DMatchVector(inliers.toArray(new DMatch[0]));
        drawMatches(left, leftFeatures.getKeyPoints(), right, rightFeatures.getKeyPoints(),
                matches, out, Scalar.all(-1), Scalar.all(-1), new BytePointer(), NOT_DRAW_SINGLE_POINTS);
        matches.close();
        return out;
    }

    private List<Mat> materials(boolean gray, boolean equalize) {
        if (!equalize) return gray ? projectedGray : projectedImages;
        if (gray) {
            if (grayEqualized == null) grayEqualized = equalizeAll(projectedGray);
            return grayEqualized;
        }
        if (bgrEqualized == null) bgrEqualized = equalizeAll(projectedImages);
        return bgrEqualized;
    }

    private List<Mat> equalizeAll(List<Mat> images) {
        return runAll(images.size(), i -> equalize(images.get(i)));
    }

    /**
     * Histogram equalization, each channel on its own.
     */
    static Mat equalize(Mat image) {
        MatVector planes = new MatVector();
        split(image, planes);
        for (long i = 0; i < planes.size(); i++) {
            Mat plane = planes.get(i);
            equalizeHist(plane, plane);
        }
        Mat output = new Mat();
        merge(planes, output);
        return output;
    }

    private static Mat toBgr(Mat gray) {
        Mat bgr = new Mat();
        cvtColor(gray, bgr, COLOR_GRAY2BGR);
        return bgr;
    }

    private <T> List<T> runAll(int count, IntFunction<T> task) {
        List<CompletableFuture<T>> futures = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            final int index = i;
            futures.add(CompletableFuture.supplyAsync(() -> task.apply(index), executor));
        }
        List<T> out = new ArrayList<>(count);
        try {
            for (CompletableFuture<T> future : futures) {
                out.add(future.join());
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof PanoramaException) {
                throw (PanoramaException) e.getCause();
            }
            throw e;
        }
        return out;
    }
}
