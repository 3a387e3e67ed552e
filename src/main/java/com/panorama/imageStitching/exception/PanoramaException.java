package com.panorama.imageStitching.exception;

/**
 * Root of every failure raised while building a panorama.
 */
public class PanoramaException extends RuntimeException {

    public PanoramaException(String message) {
        super(message);
    }

    public PanoramaException(String message, Throwable cause) {
        super(message, cause);
    }
}
