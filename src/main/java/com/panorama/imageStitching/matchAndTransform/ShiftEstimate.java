package com.panorama.imageStitching.matchAndTransform;

import lombok.Getter;
import org.bytedeco.opencv.opencv_core.DMatch;

import java.util.Collections;
import java.util.List;

/**
 * Mean translation between image i and image i+1, rounded to whole pixels.
 * {@code dx} is the distance image i+1 moves to the right, {@code dy} may be negative.
 */
@Getter
public class ShiftEstimate {
    private final int dx;
    private final int dy;
    private final List<DMatch> inlierMatches;

    public ShiftEstimate(int dx, int dy) {
        this(dx, dy, Collections.emptyList());
    }

    public ShiftEstimate(int dx, int dy, List<DMatch> inlierMatches) {
        this.dx = dx;
        this.dy = dy;
        this.inlierMatches = Collections.unmodifiableList(inlierMatches);
    }

    @Override
    public String toString() {
        return "(" + dx + ", " + dy + ") from " + inlierMatches.size() + " inliers";
    }
}
