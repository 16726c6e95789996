package com.flowmable.colormatch;

/**
 * The reference chosen for a source image.
 *
 * @param name     Identifier of the reference in its set
 * @param buffer   The reference pixels
 * @param distance Weighted mean distance to the source
 */
public record ReferenceMatch(String name, PixelBuffer buffer, double distance) {}
