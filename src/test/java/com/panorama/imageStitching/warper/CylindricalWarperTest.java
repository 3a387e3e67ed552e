package com.panorama.imageStitching.warper;

import com.panorama.imageStitching.SyntheticImages;
import com.panorama.imageStitching.exception.PanoramaConfigurationException;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;

import static com.panorama.imageStitching.SyntheticImages.pixel;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CylindricalWarperTest {

    @Test
    void keepsSizeAndCenterColumn() {
        Mat source = SyntheticImages.texturedScene(320, 240, 7);
        Mat warped = CylindricalWarper.warp(source, Math.toRadians(30));

        assertThat(warped.cols()).isEqualTo(320);
        assertThat(warped.rows()).isEqualTo(240);
        assertThat(warped.type()).isEqualTo(source.type());
        // Cột giữa: theta = 0 nên lấy mẫu đúng pixel nguồn
        for (int row = 0; row < 240; row += 17) {
            for (int ch = 0; ch < 3; ch++) {
                assertThat(pixel(warped, row, 160, ch)).isEqualTo(pixel(source, row, 160, ch));
            }
        }
    }

    @Test
    void samplesOutsideSourceBecomeBlack() {
        Mat source = SyntheticImages.solid(320, 240, 200, 200, 200);
        Mat warped = CylindricalWarper.warp(source, Math.toRadians(30));

        // x = 0 samples f * tan(-160 / f) + 160 < 0 for f ~ 277
        assertThat(pixel(warped, 120, 0, 0)).isZero();
        assertThat(pixel(warped, 120, 319, 0)).isZero();
        assertThat(pixel(warped, 120, 160, 0)).isEqualTo(200);
    }

    @Test
    void focalLengthFromHalfFov() {
        assertThat(CylindricalWarper.focalLength(200, Math.toRadians(45))).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void rejectsInvalidHalfFov() {
        Mat source = SyntheticImages.solid(10, 10, 1, 2, 3);
        assertThatThrownBy(() -> CylindricalWarper.warp(source, 0))
                .isInstanceOf(PanoramaConfigurationException.class);
        assertThatThrownBy(() -> CylindricalWarper.warp(source, -0.5))
                .isInstanceOf(PanoramaConfigurationException.class);
        assertThatThrownBy(() -> CylindricalWarper.warp(source, Double.NaN))
                .isInstanceOf(PanoramaConfigurationException.class);
        assertThatThrownBy(() -> CylindricalWarper.warp(source, Math.PI / 2))
                .isInstanceOf(PanoramaConfigurationException.class);
    }
}
