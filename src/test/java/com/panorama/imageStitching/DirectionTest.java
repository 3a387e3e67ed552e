package com.panorama.imageStitching;

import com.panorama.imageStitching.exception.PanoramaConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectionTest {

    @Test
    void parsesShortAndLongNames() {
        assertThat(Direction.fromName("r")).isEqualTo(Direction.RIGHT);
        assertThat(Direction.fromName("L")).isEqualTo(Direction.LEFT);
        assertThat(Direction.fromName("left")).isEqualTo(Direction.LEFT);
    }

    @Test
    void rejectsAnythingElse() {
        assertThatThrownBy(() -> Direction.fromName("x")).isInstanceOf(PanoramaConfigurationException.class);
        assertThatThrownBy(() -> Direction.fromName(null)).isInstanceOf(PanoramaConfigurationException.class);
    }
}
