package com.panorama.imageStitching.matchAndTransform;

import com.panorama.imageStitching.exception.DegenerateFeaturesException;
import com.panorama.imageStitching.exception.InsufficientCorrespondenceException;
import com.panorama.imageStitching.exception.PanoramaConfigurationException;
import com.panorama.imageStitching.feature.FeatureSet;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.FloatPointer;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.opencv_core.*;
import org.bytedeco.opencv.opencv_features2d.BFMatcher;

import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_calib3d.RANSAC;
import static org.bytedeco.opencv.global.opencv_calib3d.findHomography;
import static org.bytedeco.opencv.global.opencv_core.*;

/**
 * Estimates the translation between two adjacent projected images.
 * <ol>
 *     <li>brute-force nearest descriptor (L2) for every feature of the left image;</li>
 *     <li>keep matches with distance &lt;= max(1, min distance) * distRatio;</li>
 *     <li>drop the outliers of a RANSAC homography fit, which must be close to a pure translation;</li>
 *     <li>average the displacement of the remaining inliers.</li>
 * </ol>
 */
@Slf4j
@Getter
public class CorrespondenceMatcher {
    public static final double DEFAULT_RANSAC_THRESHOLD = 3.0;
    public static final int DEFAULT_MIN_INLIERS = 10;

    // findHomography cần ít nhất 4 cặp điểm
    static final int MIN_HOMOGRAPHY_POINTS = 4;
    // Ảnh đã chiếu lên trụ chỉ lệch nhau một phép tịnh tiến
    static final double MAX_LINEAR_DEVIATION = 0.1;
    static final double MAX_PERSPECTIVE = 1e-3;
    private static final int RANSAC_MAX_ITERS = 2000;
    private static final double RANSAC_CONFIDENCE = 0.995;

    private final double distRatio;
    private final double ransacThreshold;
    private final int minInliers;

    public CorrespondenceMatcher(double distRatio) {
        this(distRatio, DEFAULT_RANSAC_THRESHOLD, DEFAULT_MIN_INLIERS);
    }

    public CorrespondenceMatcher(double distRatio, double ransacThreshold, int minInliers) {
        this.distRatio = distRatio;
        this.ransacThreshold = ransacThreshold;
        // Mẫu tối thiểu 4 điểm luôn khớp chính nó, nên ngưỡng phải lớn hơn
        if (minInliers <= MIN_HOMOGRAPHY_POINTS) {
            throw new PanoramaConfigurationException("Minimum inlier count must exceed " + MIN_HOMOGRAPHY_POINTS
                    + " to mean anything, got " + minInliers);
        }
        this.minInliers = minInliers;
    }

    /**
     * @param pairIndex Index i of the pair (i, i+1), used in error reports
     * @param left      Features of image i
     * @param right     Features of image i+1
     * @return Shift of image i+1 relative to image i, with the inlier matches
     */
    public ShiftEstimate estimate(int pairIndex, FeatureSet left, FeatureSet right) {
        if (left.isEmpty()) throw new DegenerateFeaturesException(pairIndex, pairIndex);
        if (right.isEmpty()) throw new DegenerateFeaturesException(pairIndex, pairIndex + 1);

        List<DMatch> closeMatches = filterByDistance(match(left, right));
        if (closeMatches.size() < MIN_HOMOGRAPHY_POINTS) {
            throw new InsufficientCorrespondenceException(pairIndex,
                    closeMatches.size() + " matches left after the distance filter, need " + MIN_HOMOGRAPHY_POINTS);
        }

        int count = closeMatches.size();
        float[] leftXY = new float[count * 2];
        float[] rightXY = new float[count * 2];
        for (int i = 0; i < count; i++) {
            DMatch m = closeMatches.get(i);
            Point2f p1 = left.point(m.queryIdx());
            Point2f p2 = right.point(m.trainIdx());
            leftXY[2 * i] = p1.x();
            leftXY[2 * i + 1] = p1.y();
            rightXY[2 * i] = p2.x();
            rightXY[2 * i + 1] = p2.y();
        }

        // Chạy RANSAC để lấy mask lọc điểm nhiễu
        Mat m1 = toPointMat(leftXY);
        Mat m2 = toPointMat(rightXY);
        Mat mask = new Mat();
        Mat homography = findHomography(m1, m2, RANSAC, ransacThreshold, mask, RANSAC_MAX_ITERS, RANSAC_CONFIDENCE);

        List<DMatch> inliers = new ArrayList<>();
        List<float[]> displacements = new ArrayList<>();
        boolean translation = !homography.empty() && isNearTranslation(homography);
        if (translation && !mask.empty()) {
            BytePointer maskPtr = mask.data();
            for (int i = 0; i < count; i++) {
                if (maskPtr.get(i) == 0) continue;
                inliers.add(closeMatches.get(i));
                // Ảnh đi sang phải nên dx luôn dương, dy có thể âm
                displacements.add(new float[]{
                        leftXY[2 * i] - rightXY[2 * i],
                        leftXY[2 * i + 1] - rightXY[2 * i + 1]});
            }
        }
        m1.release();
        m2.release();
        mask.release();
        homography.release();

        if (!translation) {
            throw new InsufficientCorrespondenceException(pairIndex,
                    "consensus fit over " + count + " matches is not a translation");
        }
        if (inliers.size() < minInliers) {
            throw new InsufficientCorrespondenceException(pairIndex,
                    inliers.size() + " consensus inliers out of " + count + " matches, need " + minInliers);
        }

        int[] shift = meanShift(pairIndex, displacements);
        ShiftEstimate estimate = new ShiftEstimate(shift[0], shift[1], inliers);
        log.debug("Pair {}-{}: {} close matches, shift {}", pairIndex, pairIndex + 1, count, estimate);
        return estimate;
    }

    /**
     * Nearest neighbour in {@code right} for every descriptor of {@code left}.
     */
    List<DMatch> match(FeatureSet left, FeatureSet right) {
        BFMatcher matcher = new BFMatcher(NORM_L2, false);
        DMatchVector matches = new DMatchVector();
        matcher.match(left.getDescriptors(), right.getDescriptors(), matches);

        List<DMatch> result = new ArrayList<>((int) matches.size());
        for (long i = 0; i < matches.size(); i++) {
            DMatch m = matches.get(i);
            // Copy ra khỏi vector native trước khi vector bị giải phóng
            result.add(new DMatch(m.queryIdx(), m.trainIdx(), m.distance()));
        }
        matcher.close();
        return result;
    }

    /**
     * Global threshold: every match within {@code max(1, min distance) * distRatio} survives.
     */
    List<DMatch> filterByDistance(List<DMatch> matches) {
        if (matches.isEmpty()) return matches;

        float minDistance = Float.MAX_VALUE;
        for (DMatch m : matches) {
            if (m.distance() < minDistance) minDistance = m.distance();
        }
        double threshold = Math.max(1.0f, minDistance) * distRatio;

        List<DMatch> close = new ArrayList<>();
        for (DMatch m : matches) {
            if (m.distance() <= threshold) close.add(m);
        }
        return close;
    }

    static int[] meanShift(int pairIndex, List<float[]> displacements) {
        if (displacements.isEmpty()) {
            throw new InsufficientCorrespondenceException(pairIndex, "no inlier displacement to average");
        }
        double sumDx = 0, sumDy = 0;
        for (float[] d : displacements) {
            sumDx += d[0];
            sumDy += d[1];
        }
        int n = displacements.size();
        return new int[]{(int) Math.round(sumDx / n), (int) Math.round(sumDy / n)};
    }

    /**
     * Linear part close to identity and no perspective term. Chance inliers between
     * unrelated images fit a warped homography instead.
     */
    static boolean isNearTranslation(Mat homography) {
        DoubleIndexer h = homography.createIndexer();
        try {
            return Math.abs(h.get(0, 0) - 1) <= MAX_LINEAR_DEVIATION
                    && Math.abs(h.get(1, 1) - 1) <= MAX_LINEAR_DEVIATION
                    && Math.abs(h.get(0, 1)) <= MAX_LINEAR_DEVIATION
                    && Math.abs(h.get(1, 0)) <= MAX_LINEAR_DEVIATION
                    && Math.abs(h.get(2, 0)) <= MAX_PERSPECTIVE
                    && Math.abs(h.get(2, 1)) <= MAX_PERSPECTIVE;
        } finally {
            h.release();
        }
    }

    private static Mat toPointMat(float[] xy) {
        Mat mat = new Mat(xy.length / 2, 1, CV_32FC2);
        new FloatPointer(mat.data()).put(xy);
        return mat;
    }
}
