package com.panorama.imageStitching.exception;

import lombok.Getter;

/**
 * An adjacent pair (i, i+1) could not produce a usable shift.
 */
@Getter
public class InsufficientCorrespondenceException extends PanoramaException {
    private final int pairIndex;

    public InsufficientCorrespondenceException(int pairIndex, String message) {
        super("Pair " + pairIndex + "-" + (pairIndex + 1) + ": " + message);
        this.pairIndex = pairIndex;
    }
}
