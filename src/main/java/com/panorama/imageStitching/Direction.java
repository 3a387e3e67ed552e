package com.panorama.imageStitching;

import com.panorama.imageStitching.exception.PanoramaConfigurationException;

import java.util.Locale;

/**
 * Order in which the source images were supplied.
 */
public enum Direction {
    /** Left to right, processed as given. */
    RIGHT,
    /** Right to left, reversed once before processing. */
    LEFT;

    /**
     * Accepts {@code r}/{@code l} as well as the full names.
     */
    public static Direction fromName(String name) {
        if (name != null) {
            switch (name.trim().toLowerCase(Locale.ROOT)) {
                case "r":
                case "right":
                    return RIGHT;
                case "l":
                case "left":
                    return LEFT;
                default:
                    break;
            }
        }
        throw new PanoramaConfigurationException("Direction must be \"l\" or \"r\", got " + name);
    }
}
