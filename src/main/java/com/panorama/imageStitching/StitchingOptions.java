package com.panorama.imageStitching;

import com.panorama.imageStitching.feature.FeatureExtractor;
import com.panorama.imageStitching.feature.SiftFeatureExtractor;
import com.panorama.imageStitching.matchAndTransform.CorrespondenceMatcher;
import lombok.Builder;
import lombok.Getter;

/**
 * Tunables of one stitching run.
 */
@Getter
@Builder(toBuilder = true)
public class StitchingOptions {
    /** Half of the camera field of view, in degrees. */
    private final double halfFovDegrees;

    /** Matches farther than max(1, min distance) * distRatio are dropped. */
    @Builder.Default
    private final double distRatio = 10;

    @Builder.Default
    private final Direction direction = Direction.RIGHT;

    @Builder.Default
    private final FeatureExtractor extractor = new SiftFeatureExtractor();

    @Builder.Default
    private final double ransacThreshold = CorrespondenceMatcher.DEFAULT_RANSAC_THRESHOLD;

    @Builder.Default
    private final int minInliers = CorrespondenceMatcher.DEFAULT_MIN_INLIERS;
}
