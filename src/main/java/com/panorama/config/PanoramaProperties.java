package com.panorama.config;

import com.panorama.imageStitching.Direction;
import com.panorama.imageStitching.feature.DetectorType;
import com.panorama.imageStitching.feature.OrbFeatureExtractor;
import com.panorama.imageStitching.matchAndTransform.CorrespondenceMatcher;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Defaults for stitching requests, bound from {@code panorama.*}.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "panorama")
public class PanoramaProperties {

    /** Full field of view of the camera in degrees. */
    private double fov = 66;

    private double distRatio = 10;

    private Direction direction = Direction.RIGHT;

    private DetectorType detector = DetectorType.SIFT;

    private int orbMaxFeatures = OrbFeatureExtractor.DEFAULT_MAX_FEATURES;

    private double ransacThreshold = CorrespondenceMatcher.DEFAULT_RANSAC_THRESHOLD;

    private int minInliers = CorrespondenceMatcher.DEFAULT_MIN_INLIERS;

    private int threads = Runtime.getRuntime().availableProcessors();

    private String uploadDir = "uploads";

    private String outputDir = "panorama";
}
