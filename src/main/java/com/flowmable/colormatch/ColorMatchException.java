package com.flowmable.colormatch;

/**
 * Base class for failures reported by the color matching core.
 * <p>
 * The core throws these fast and never catches them itself; front-ends decide
 * how to present them.
 */
public class ColorMatchException extends RuntimeException {

    public ColorMatchException(String message) {
        super(message);
    }
}
