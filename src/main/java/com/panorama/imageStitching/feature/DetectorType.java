package com.panorama.imageStitching.feature;

import com.panorama.imageStitching.exception.PanoramaConfigurationException;

import java.util.Locale;

public enum DetectorType {
    SIFT,
    ORB;

    public FeatureExtractor create(int orbMaxFeatures) {
        switch (this) {
            case ORB:
                return new OrbFeatureExtractor(orbMaxFeatures);
            case SIFT:
            default:
                return new SiftFeatureExtractor();
        }
    }

    public FeatureExtractor create() {
        return create(OrbFeatureExtractor.DEFAULT_MAX_FEATURES);
    }

    public static DetectorType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new PanoramaConfigurationException("Detector name is missing");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new PanoramaConfigurationException("Unknown detector: " + name);
        }
    }
}
