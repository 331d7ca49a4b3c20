package com.flowmable.stitcher;

/**
 * A shape that cannot be written to an embroidery document.
 */
public class StitchEncodingException extends RuntimeException {

    public StitchEncodingException(String message) {
        super(message);
    }
}
