package com.panorama.imageStitching.exception;

/**
 * Invalid input or tunables, detected before any stitching work starts.
 */
public class PanoramaConfigurationException extends PanoramaException {

    public PanoramaConfigurationException(String message) {
        super(message);
    }
}
