package com.panorama.API;

import lombok.Builder;
import lombok.Getter;

/**
 * Per-request overrides; a null field falls back to {@code panorama.*} properties.
 */
@Getter
@Builder
public class StitchingRequest {
    /** Full field of view in degrees. */
    private final Double fov;
    private final String direction;
    private final String detector;
    private final Double distRatio;
    private final boolean draw;
}
