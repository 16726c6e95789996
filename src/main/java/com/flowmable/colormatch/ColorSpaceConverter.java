package com.flowmable.colormatch;

/**
 * Converts between the display representation (8-bit RGB) and a separated
 * lightness / color-opponent space.
 * <p>
 * The separated representation is an interleaved float array with three
 * values per pixel, nominally in [0, 255] per channel.
 */
public interface ColorSpaceConverter {

    /**
     * Convert an RGB buffer to interleaved separated-space values.
     */
    float[] toSeparated(PixelBuffer rgb);

    /**
     * Convert interleaved separated-space values back to an RGB buffer.
     * Values that map outside the displayable range are clamped.
     */
    PixelBuffer fromSeparated(float[] separated, int width, int height);
}
