package com.panorama.imageStitching.feature;

import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Detector family used to find key points on projected grayscale images.
 * Implementations must be safe to call from several worker threads at once.
 */
public interface FeatureExtractor {

    FeatureSet detect(Mat grayImage);
}
