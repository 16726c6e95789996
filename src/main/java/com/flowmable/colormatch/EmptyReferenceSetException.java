package com.flowmable.colormatch;

/**
 * Reference selection was asked to choose from no candidates.
 */
public class EmptyReferenceSetException extends ColorMatchException {

    public EmptyReferenceSetException(String message) {
        super(message);
    }
}
