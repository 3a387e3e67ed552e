package com.panorama.imageStitching.feature;

import lombok.Getter;
import org.bytedeco.opencv.opencv_core.KeyPointVector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point2f;

/**
 * Key points of one projected grayscale image together with their descriptors,
 * one descriptor row per key point.
 */
@Getter
public class FeatureSet {
    private final KeyPointVector keyPoints;
    private final Mat descriptors;

    public FeatureSet(KeyPointVector keyPoints, Mat descriptors) {
        this.keyPoints = keyPoints;
        this.descriptors = descriptors;
    }

    public int size() {
        return (int) keyPoints.size();
    }

    public boolean isEmpty() {
        return keyPoints.size() == 0 || descriptors.empty();
    }

    public Point2f point(int index) {
        return keyPoints.get(index).pt();
    }
}
