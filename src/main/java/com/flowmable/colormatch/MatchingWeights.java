package com.flowmable.colormatch;

/**
 * Weights of the reference-selection distance.
 * <p>
 * {@code distance = sqrt(lightnessWeight·ΔL² + colorWeight·ΔA² + colorWeight·ΔB²)}
 * over channel means. The default favors exposure over hue by 1.5×; it is a
 * tuning default, not a derived constant.
 *
 * @param lightnessWeight Weight of the squared lightness-mean difference
 * @param colorWeight     Weight of each squared opponent-channel mean difference
 */
public record MatchingWeights(double lightnessWeight, double colorWeight) {

    public static final MatchingWeights DEFAULT = new MatchingWeights(
            1.5, // lightnessWeight
            1.0  // colorWeight
    );

    public MatchingWeights {
        requireWeight("lightnessWeight", lightnessWeight);
        requireWeight("colorWeight", colorWeight);
    }

    /**
     * Weighted distance between the channel means of two images.
     */
    public double distance(ImageStats source, ImageStats candidate) {
        double dL = source.l().mean() - candidate.l().mean();
        double dA = source.a().mean() - candidate.a().mean();
        double dB = source.b().mean() - candidate.b().mean();
        return Math.sqrt(lightnessWeight * dL * dL + colorWeight * dA * dA + colorWeight * dB * dB);
    }

    private static void requireWeight(String name, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new InvalidParameterException(name + " must be a finite, non-negative number, got " + value);
        }
    }
}
