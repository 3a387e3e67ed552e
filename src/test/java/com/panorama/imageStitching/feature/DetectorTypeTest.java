package com.panorama.imageStitching.feature;

import com.panorama.imageStitching.exception.PanoramaConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectorTypeTest {

    @Test
    void parsesNamesIgnoringCase() {
        assertThat(DetectorType.fromName("sift")).isEqualTo(DetectorType.SIFT);
        assertThat(DetectorType.fromName(" Orb ")).isEqualTo(DetectorType.ORB);
    }

    @Test
    void createsMatchingExtractor() {
        assertThat(DetectorType.SIFT.create()).isInstanceOf(SiftFeatureExtractor.class);
        FeatureExtractor orb = DetectorType.ORB.create(1200);
        assertThat(orb).isInstanceOf(OrbFeatureExtractor.class);
        assertThat(((OrbFeatureExtractor) orb).getMaxFeatures()).isEqualTo(1200);
        assertThat(((OrbFeatureExtractor) DetectorType.ORB.create()).getMaxFeatures()).isEqualTo(5000);
    }

    @Test
    void rejectsUnknownDetector() {
        assertThatThrownBy(() -> DetectorType.fromName("surf"))
                .isInstanceOf(PanoramaConfigurationException.class)
                .hasMessageContaining("surf");
        assertThatThrownBy(() -> DetectorType.fromName(null))
                .isInstanceOf(PanoramaConfigurationException.class);
    }
}
