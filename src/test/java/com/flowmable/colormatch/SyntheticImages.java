package com.flowmable.colormatch;

/**
 * Generators for synthetic test buffers.
 */
final class SyntheticImages {

    private SyntheticImages() {}

    /** Horizontal gradient from color A to color B. */
    static PixelBuffer gradient(int width, int height,
                                int r1, int g1, int b1,
                                int r2, int g2, int b2) {
        PixelBuffer buffer = PixelBuffer.rgb(width, height);
        byte[] data = buffer.data();
        for (int x = 0; x < width; x++) {
            double t = width == 1 ? 0.0 : x / (double) (width - 1);
            int r = (int) Math.round(r1 + t * (r2 - r1));
            int g = (int) Math.round(g1 + t * (g2 - g1));
            int b = (int) Math.round(b1 + t * (b2 - b1));
            for (int y = 0; y < height; y++) {
                int idx = (y * width + x) * 3;
                data[idx] = (byte) r;
                data[idx + 1] = (byte) g;
                data[idx + 2] = (byte) b;
            }
        }
        return buffer;
    }

    /** Top half color A, bottom half color B. */
    static PixelBuffer twoColorSplit(int width, int height,
                                     int r1, int g1, int b1,
                                     int r2, int g2, int b2) {
        PixelBuffer buffer = PixelBuffer.rgb(width, height);
        byte[] data = buffer.data();
        for (int y = 0; y < height; y++) {
            boolean top = y < height / 2;
            for (int x = 0; x < width; x++) {
                int idx = (y * width + x) * 3;
                data[idx] = (byte) (top ? r1 : r2);
                data[idx + 1] = (byte) (top ? g1 : g2);
                data[idx + 2] = (byte) (top ? b1 : b2);
            }
        }
        return buffer;
    }

    /** Smooth two-axis pattern with varied hue, lightness and saturation. */
    static PixelBuffer colorful(int width, int height) {
        PixelBuffer buffer = PixelBuffer.rgb(width, height);
        byte[] data = buffer.data();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int idx = (y * width + x) * 3;
                data[idx] = (byte) (40 + (x * 170) / Math.max(1, width - 1));
                data[idx + 1] = (byte) (60 + (y * 150) / Math.max(1, height - 1));
                data[idx + 2] = (byte) (200 - ((x + y) * 120) / Math.max(1, width + height - 2));
            }
        }
        return buffer;
    }

    static PixelBuffer copyOf(PixelBuffer buffer) {
        return new PixelBuffer(buffer.width(), buffer.height(), buffer.channels(), buffer.data().clone());
    }

    static int maxSampleDifference(PixelBuffer a, PixelBuffer b) {
        int max = 0;
        for (int i = 0; i < a.data().length; i++) {
            max = Math.max(max, Math.abs((a.data()[i] & 0xFF) - (b.data()[i] & 0xFF)));
        }
        return max;
    }
}
