package com.panorama.imageStitching.feature;

import org.bytedeco.opencv.opencv_core.KeyPointVector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_features2d.SIFT;

public class SiftFeatureExtractor implements FeatureExtractor {

    @Override
    public FeatureSet detect(Mat grayImage) {
        // SIFT của OpenCV không thread-safe, mỗi lần gọi tạo một detector riêng
        SIFT sift = SIFT.create();
        KeyPointVector keyPoints = new KeyPointVector();
        Mat descriptors = new Mat();
        sift.detectAndCompute(grayImage, new Mat(), keyPoints, descriptors);
        sift.close();
        return new FeatureSet(keyPoints, descriptors);
    }

    @Override
    public String toString() {
        return "SIFT";
    }
}
