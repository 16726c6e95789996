package com.flowmable.colormatch;

/**
 * Computes per-channel mean and population standard deviation of an image
 * in the separated color space.
 * <p>
 * Every sample contributes; there is no subsampling. Arithmetic runs in
 * double precision, so results depend only on the pixel values and not on
 * any state of this object.
 */
public class StatsExtractor {

    private final ColorSpaceConverter converter;

    public StatsExtractor() {
        this(new LabColorSpaceConverter());
    }

    public StatsExtractor(ColorSpaceConverter converter) {
        if (converter == null) {
            throw new InvalidParameterException("Color space converter must not be null");
        }
        this.converter = converter;
    }

    public ColorSpaceConverter converter() {
        return converter;
    }

    /**
     * Compute statistics for an RGB buffer.
     *
     * @throws InvalidInputException if the buffer is null, empty, or not 3-channel
     */
    public ImageStats computeStats(PixelBuffer buffer) {
        if (buffer == null) {
            throw new InvalidInputException("Pixel buffer must not be null");
        }
        buffer.requireValidRgb();
        return computeStats(converter.toSeparated(buffer));
    }

    /**
     * Compute statistics of an already converted, interleaved 3-channel array.
     */
    public ImageStats computeStats(float[] separated) {
        if (separated.length == 0 || separated.length % 3 != 0) {
            throw new InvalidInputException("Expected a non-empty 3-channel array, got " + separated.length + " values");
        }
        return new ImageStats(
                channelStats(separated, 0),
                channelStats(separated, 1),
                channelStats(separated, 2));
    }

    private static ChannelStats channelStats(float[] values, int channel) {
        int n = values.length / 3;

        double sum = 0;
        for (int i = channel; i < values.length; i += 3) {
            sum += values[i];
        }
        double mean = sum / n;

        // Second pass keeps the variance exact for flat channels
        double sumSq = 0;
        for (int i = channel; i < values.length; i += 3) {
            double d = values[i] - mean;
            sumSq += d * d;
        }
        return new ChannelStats(mean, Math.sqrt(sumSq / n));
    }
}
