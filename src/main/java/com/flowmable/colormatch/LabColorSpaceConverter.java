package com.flowmable.colormatch;

/**
 * Default {@link ColorSpaceConverter}: sRGB ⇄ CIELAB (D65) on the 8-bit Lab scale.
 * <p>
 * A gray pixel encodes to A = B = 128. Stateless, so all instances of this
 * class are equal and share {@link ReferenceStatsCache} entries.
 */
public class LabColorSpaceConverter implements ColorSpaceConverter {

    @Override
    public float[] toSeparated(PixelBuffer rgb) {
        rgb.requireValidRgb();
        int n = rgb.pixelCount();
        byte[] data = rgb.data();
        float[] out = new float[n * 3];

        for (int i = 0; i < n * 3; i += 3) {
            int r = data[i] & 0xFF;
            int g = data[i + 1] & 0xFF;
            int b = data[i + 2] & 0xFF;
            double[] lab = ColorSpaceUtils.encodeLab(ColorSpaceUtils.srgbToLab(r, g, b));
            out[i] = (float) lab[0];
            out[i + 1] = (float) lab[1];
            out[i + 2] = (float) lab[2];
        }
        return out;
    }

    @Override
    public PixelBuffer fromSeparated(float[] separated, int width, int height) {
        int n = width * height;
        if (separated.length != n * 3) {
            throw new InvalidInputException(String.format(
                    "Expected %d separated values for %dx%d, got %d", n * 3, width, height, separated.length));
        }
        byte[] data = new byte[n * 3];

        for (int i = 0; i < n * 3; i += 3) {
            double[] lab = ColorSpaceUtils.decodeLab(separated[i], separated[i + 1], separated[i + 2]);
            double[] rgb = ColorSpaceUtils.labToSrgb(lab[0], lab[1], lab[2]);
            data[i] = (byte) ColorSpaceUtils.clampToByte(rgb[0]);
            data[i + 1] = (byte) ColorSpaceUtils.clampToByte(rgb[1]);
            data[i + 2] = (byte) ColorSpaceUtils.clampToByte(rgb[2]);
        }
        return new PixelBuffer(width, height, PixelBuffer.RGB_CHANNELS, data);
    }

    @Override
    public boolean equals(Object o) {
        return o != null && o.getClass() == getClass();
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
