package com.panorama.API;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * File names of the written panoramas, relative to the output directory.
 */
@Getter
@AllArgsConstructor
public class StitchingResult {
    /** color, color equalized, grayscale, grayscale equalized */
    private final List<String> variants;
    private final List<String> matchImages;
}
