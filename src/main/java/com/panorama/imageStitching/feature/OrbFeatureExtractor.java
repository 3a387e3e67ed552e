package com.panorama.imageStitching.feature;

import lombok.Getter;
import org.bytedeco.opencv.opencv_core.KeyPointVector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_features2d.ORB;

/**
 * Binary-descriptor detector, capped at {@code maxFeatures} key points per image.
 */
@Getter
public class OrbFeatureExtractor implements FeatureExtractor {
    public static final int DEFAULT_MAX_FEATURES = 5000;

    private final int maxFeatures;

    public OrbFeatureExtractor() {
        this(DEFAULT_MAX_FEATURES);
    }

    public OrbFeatureExtractor(int maxFeatures) {
        this.maxFeatures = maxFeatures;
    }

    @Override
    public FeatureSet detect(Mat grayImage) {
        ORB orb = ORB.create();
        orb.setMaxFeatures(maxFeatures);
        KeyPointVector keyPoints = new KeyPointVector();
        Mat descriptors = new Mat();
        orb.detectAndCompute(grayImage, new Mat(), keyPoints, descriptors);
        orb.close();
        return new FeatureSet(keyPoints, descriptors);
    }

    @Override
    public String toString() {
        return "ORB(" + maxFeatures + ")";
    }
}
