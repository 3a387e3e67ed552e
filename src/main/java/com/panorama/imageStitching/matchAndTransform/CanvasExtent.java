package com.panorama.imageStitching.matchAndTransform;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Cumulative bounds of every image origin in the chain, origin included:
 * left &lt;= 0 &lt;= right and upper &lt;= 0 &lt;= lower.
 */
@Getter
@EqualsAndHashCode
public class CanvasExtent {
    public static final CanvasExtent ORIGIN = new CanvasExtent(0, 0, 0, 0);

    private final int left;
    private final int right;
    private final int upper;
    private final int lower;

    public CanvasExtent(int left, int right, int upper, int lower) {
        this.left = left;
        this.right = right;
        this.upper = upper;
        this.lower = lower;
    }

    public CanvasExtent include(int x, int y) {
        return new CanvasExtent(Math.min(left, x), Math.max(right, x), Math.min(upper, y), Math.max(lower, y));
    }

    public int horizontalSpan() {
        return right - left;
    }

    public int verticalSpan() {
        return lower - upper;
    }

    @Override
    public String toString() {
        return "[left=" + left + ", right=" + right + ", upper=" + upper + ", lower=" + lower + "]";
    }
}
