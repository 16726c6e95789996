package com.flowmable.colormatch;

/**
 * An 8-bit interleaved pixel buffer.
 * <p>
 * Samples are stored row-major as {@code data[(y * width + x) * channels + c]}
 * and read as unsigned values. Color buffers use channel order R, G, B.
 * The color matcher never writes into a buffer it receives; every operation
 * returns a new one.
 *
 * @param width    Width in pixels
 * @param height   Height in pixels
 * @param channels Samples per pixel (3 for every buffer the matcher accepts)
 * @param data     Interleaved samples, {@code width * height * channels} long
 */
public record PixelBuffer(int width, int height, int channels, byte[] data) {

    public static final int RGB_CHANNELS = 3;

    public PixelBuffer {
        if (data == null) {
            throw new InvalidInputException("Pixel data must not be null");
        }
        if (width < 0 || height < 0 || channels < 0) {
            throw new InvalidInputException(String.format(
                    "Negative buffer shape: %dx%dx%d", width, height, channels));
        }
        if ((long) width * height * channels != data.length) {
            throw new InvalidInputException(String.format(
                    "Buffer shape %dx%dx%d does not match %d samples", width, height, channels, data.length));
        }
    }

    /**
     * Create a blank RGB buffer.
     */
    public static PixelBuffer rgb(int width, int height) {
        return new PixelBuffer(width, height, RGB_CHANNELS, new byte[width * height * RGB_CHANNELS]);
    }

    /**
     * Create an RGB buffer filled with a single color.
     */
    public static PixelBuffer uniform(int width, int height, int r, int g, int b) {
        byte[] data = new byte[width * height * RGB_CHANNELS];
        for (int i = 0; i < data.length; i += RGB_CHANNELS) {
            data[i] = (byte) r;
            data[i + 1] = (byte) g;
            data[i + 2] = (byte) b;
        }
        return new PixelBuffer(width, height, RGB_CHANNELS, data);
    }

    public int pixelCount() {
        return width * height;
    }

    /**
     * Unsigned sample value (0–255) at the given pixel and channel.
     */
    public int sample(int x, int y, int channel) {
        return data[(y * width + x) * channels + channel] & 0xFF;
    }

    /**
     * Fail unless this is a non-empty buffer with exactly three channels.
     */
    public void requireValidRgb() {
        if (width == 0 || height == 0) {
            throw new InvalidInputException(String.format(
                    "Pixel buffer has zero area: %dx%d", width, height));
        }
        if (channels != RGB_CHANNELS) {
            throw new InvalidInputException(String.format(
                    "Expected %d channels, got %d", RGB_CHANNELS, channels));
        }
    }
}
