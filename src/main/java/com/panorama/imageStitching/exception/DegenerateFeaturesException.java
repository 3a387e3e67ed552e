package com.panorama.imageStitching.exception;

import lombok.Getter;

/**
 * One image of a pair yielded no feature points at all.
 */
@Getter
public class DegenerateFeaturesException extends InsufficientCorrespondenceException {
    private final int imageIndex;

    public DegenerateFeaturesException(int pairIndex, int imageIndex) {
        super(pairIndex, "image " + imageIndex + " has no feature points");
        this.imageIndex = imageIndex;
    }
}
