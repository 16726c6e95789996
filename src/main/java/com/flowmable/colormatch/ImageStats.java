package com.flowmable.colormatch;

/**
 * Per-channel statistics of an image in the separated color space.
 *
 * @param l Lightness channel
 * @param a Green–red opponent channel
 * @param b Blue–yellow opponent channel
 */
public record ImageStats(ChannelStats l, ChannelStats a, ChannelStats b) {

    /**
     * Statistics of channel {@code index} (0 = L, 1 = A, 2 = B).
     */
    public ChannelStats channel(int index) {
        return switch (index) {
            case 0 -> l;
            case 1 -> a;
            case 2 -> b;
            default -> throw new IllegalArgumentException("No channel " + index);
        };
    }
}
