package com.flowmable.colormatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Matches a photograph to a brand reference and recolors it.
 * <p>
 * Two steps, usable independently:
 * 1. Selection: pick the reference whose channel means are closest to the
 *    source under {@link MatchingWeights}.
 * 2. Transfer: shift and scale each Lab channel of the source to the
 *    reference's mean and standard deviation (Reinhard et al. 2001), then
 *    blend with the original by {@code strength}.
 * <p>
 * Instances hold no per-call state and may be shared between threads. When a
 * {@link ReferenceStatsCache} is supplied, reference and target statistics
 * are read through it.
 */
public class ColorMatcher {

    private static final Logger logger = LoggerFactory.getLogger(ColorMatcher.class);

    /** Guards the std ratio against flat source channels. */
    public static final double EPSILON = 1e-5;

    /** Blend strength used when callers don't choose one: keeps 15% of the original. */
    public static final double DEFAULT_STRENGTH = 0.85;

    private static final double CHANNEL_MIN = 0.0;
    private static final double CHANNEL_MAX = 255.0;

    private final MatchingWeights weights;
    private final StatsExtractor extractor;
    private final ReferenceStatsCache cache;

    public ColorMatcher() {
        this(MatchingWeights.DEFAULT);
    }

    public ColorMatcher(MatchingWeights weights) {
        this(weights, new StatsExtractor(), null);
    }

    /**
     * @param weights   Default selection weights
     * @param extractor Statistics source (and, through it, the color converter)
     * @param cache     Reference statistics cache, or null to compute every time
     */
    public ColorMatcher(MatchingWeights weights, StatsExtractor extractor, ReferenceStatsCache cache) {
        if (weights == null) {
            throw new InvalidParameterException("Matching weights must not be null");
        }
        if (extractor == null) {
            throw new InvalidParameterException("Stats extractor must not be null");
        }
        this.weights = weights;
        this.extractor = extractor;
        this.cache = cache;
    }

    public MatchingWeights weights() {
        return weights;
    }

    /**
     * Select the closest reference using this matcher's weights.
     */
    public ReferenceMatch selectBestReference(PixelBuffer source, Map<String, PixelBuffer> references) {
        return selectBestReference(source, references, weights);
    }

    /**
     * Select the reference whose Lab channel means are closest to {@code source}.
     * <p>
     * Candidates are visited in the map's iteration order and only a strictly
     * smaller distance replaces the current best, so the first of several equal
     * candidates wins.
     *
     * @throws EmptyReferenceSetException if there are no references
     * @throws InvalidInputException      if the source or a reference is malformed
     */
    public ReferenceMatch selectBestReference(PixelBuffer source, Map<String, PixelBuffer> references,
                                              MatchingWeights weights) {
        if (references == null || references.isEmpty()) {
            throw new EmptyReferenceSetException("At least one reference image is required");
        }
        if (weights == null) {
            throw new InvalidParameterException("Matching weights must not be null");
        }

        ImageStats sourceStats = extractor.computeStats(source);

        String bestName = null;
        PixelBuffer bestBuffer = null;
        double minDistance = Double.POSITIVE_INFINITY;

        for (Map.Entry<String, PixelBuffer> entry : references.entrySet()) {
            double distance = weights.distance(sourceStats, referenceStats(entry.getValue()));
            logger.trace("Reference {} at distance {}", entry.getKey(), distance);

            // Reference buffers are never null here, so this admits exactly the first candidate
            if (bestBuffer == null || distance < minDistance) {
                minDistance = distance;
                bestName = entry.getKey();
                bestBuffer = entry.getValue();
            }
        }

        logger.debug("Selected reference {} (distance {})", bestName, String.format("%.2f", minDistance));
        return new ReferenceMatch(bestName, bestBuffer, minDistance);
    }

    /**
     * Transfer with {@link #DEFAULT_STRENGTH}.
     */
    public PixelBuffer applyColorTransfer(PixelBuffer source, PixelBuffer target) {
        return applyColorTransfer(source, target, DEFAULT_STRENGTH);
    }

    /**
     * Recolor {@code source} so each Lab channel takes on the mean and standard
     * deviation of {@code target}, then blend with the original.
     *
     * @param strength 1.0 returns the full transfer, 0.0 the unchanged source;
     *                 values between interpolate per sample
     * @return a new buffer with the source's dimensions
     * @throws InvalidParameterException if strength is not a number in [0, 1]
     * @throws InvalidInputException     if either buffer is malformed
     */
    public PixelBuffer applyColorTransfer(PixelBuffer source, PixelBuffer target, double strength) {
        requireStrength(strength);
        if (source == null || target == null) {
            throw new InvalidInputException("Source and target buffers must not be null");
        }
        source.requireValidRgb();

        // 1. Statistics on the full-resolution source
        float[] sourceLab = extractor.converter().toSeparated(source);
        ImageStats sourceStats = extractor.computeStats(sourceLab);
        ImageStats targetStats = referenceStats(target);

        // 2. Per-channel mean/std matching, clamped to the encoded range
        float[] transferred = new float[sourceLab.length];
        for (int c = 0; c < 3; c++) {
            ChannelStats src = sourceStats.channel(c);
            ChannelStats tar = targetStats.channel(c);
            double scale = tar.std() / (src.std() + EPSILON);

            for (int i = c; i < sourceLab.length; i += 3) {
                double value = (sourceLab[i] - src.mean()) * scale + tar.mean();
                transferred[i] = (float) clamp(value);
            }
        }

        // 3. Back to RGB
        PixelBuffer full = extractor.converter().fromSeparated(transferred, source.width(), source.height());
        if (strength >= 1.0) {
            return full;
        }
        return blend(full, source, strength);
    }

    /**
     * Fail unless {@code strength} is a number in [0, 1]. Out-of-range values
     * are rejected rather than clamped.
     */
    public static void requireStrength(double strength) {
        if (!(strength >= 0.0 && strength <= 1.0)) {
            throw new InvalidParameterException("strength must be within [0.0, 1.0], got " + strength);
        }
    }

    /**
     * Per-sample {@code round(strength·transferred + (1 - strength)·original)}.
     */
    static PixelBuffer blend(PixelBuffer transferred, PixelBuffer original, double strength) {
        byte[] t = transferred.data();
        byte[] o = original.data();
        byte[] out = new byte[o.length];
        double keep = 1.0 - strength;

        for (int i = 0; i < o.length; i++) {
            double mixed = strength * (t[i] & 0xFF) + keep * (o[i] & 0xFF);
            out[i] = (byte) ColorSpaceUtils.clampToByte(mixed);
        }
        return new PixelBuffer(original.width(), original.height(), original.channels(), out);
    }

    private ImageStats referenceStats(PixelBuffer reference) {
        if (reference == null) {
            throw new InvalidInputException("Reference buffer must not be null");
        }
        return cache != null ? cache.statsFor(reference, extractor) : extractor.computeStats(reference);
    }

    private static double clamp(double value) {
        return Math.max(CHANNEL_MIN, Math.min(CHANNEL_MAX, value));
    }
}
