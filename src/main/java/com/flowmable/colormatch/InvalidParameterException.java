package com.flowmable.colormatch;

/**
 * A tuning parameter (blend strength or selection weight) is outside its valid domain.
 */
public class InvalidParameterException extends ColorMatchException {

    public InvalidParameterException(String message) {
        super(message);
    }
}
