package com.flowmable.colormatch;

/**
 * A pixel buffer is malformed: null, zero area, wrong channel count,
 * or a sample array that does not match its declared shape.
 */
public class InvalidInputException extends ColorMatchException {

    public InvalidInputException(String message) {
        super(message);
    }
}
