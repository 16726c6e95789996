package com.flowmable.colormatch;

/**
 * Per-pixel color space math.
 * <p>
 * Provides sRGB ⇄ CIELAB conversion (D65 illuminant) and the 8-bit Lab
 * encoding used by the color matcher: L* is stretched from [0, 100] to
 * [0, 255] and a*, b* are offset by 128, so all three channels share the
 * same [0, 255] range as the RGB samples they came from.
 */
public final class ColorSpaceUtils {

    private ColorSpaceUtils() {}

    // D65 white point
    private static final double XN = 0.95047;
    private static final double YN = 1.00000;
    private static final double ZN = 1.08883;

    private static final double LAB_EPSILON = 0.008856;
    private static final double LAB_KAPPA = 903.3;

    /** Scale from L* [0, 100] to the encoded lightness channel [0, 255]. */
    public static final double L_SCALE = 255.0 / 100.0;

    /** Offset applied to a* and b* in the encoded opponent channels. */
    public static final double AB_OFFSET = 128.0;

    /**
     * Convert sRGB (0–255 per channel) to CIELAB [L*, a*, b*].
     */
    public static double[] srgbToLab(int r, int g, int b) {
        // 1. sRGB → linear RGB
        double rl = gammaExpand(r / 255.0);
        double gl = gammaExpand(g / 255.0);
        double bl = gammaExpand(b / 255.0);

        // 2. Linear RGB → XYZ (D65 illuminant)
        double x = 0.4124564 * rl + 0.3575761 * gl + 0.1804375 * bl;
        double y = 0.2126729 * rl + 0.7151522 * gl + 0.0721750 * bl;
        double z = 0.0193339 * rl + 0.1191920 * gl + 0.9503041 * bl;

        // 3. XYZ → Lab
        double fx = labF(x / XN);
        double fy = labF(y / YN);
        double fz = labF(z / ZN);

        double L = 116.0 * fy - 16.0;
        double a = 500.0 * (fx - fy);
        double bStar = 200.0 * (fy - fz);
        return new double[]{L, a, bStar};
    }

    /**
     * Convert CIELAB [L*, a*, b*] back to sRGB as unclamped, unrounded values
     * on the 0–255 scale. Out-of-gamut colors fall outside [0, 255].
     */
    public static double[] labToSrgb(double L, double a, double bStar) {
        // 1. Lab → XYZ
        double fy = (L + 16.0) / 116.0;
        double fx = fy + a / 500.0;
        double fz = fy - bStar / 200.0;

        double x = labFInverse(fx) * XN;
        double y = labFInverse(fy) * YN;
        double z = labFInverse(fz) * ZN;

        // 2. XYZ → linear RGB (inverse of the matrix in srgbToLab)
        double rl = 3.2404542 * x - 1.5371385 * y - 0.4985314 * z;
        double gl = -0.9692660 * x + 1.8760108 * y + 0.0415560 * z;
        double bl = 0.0556434 * x - 0.2040259 * y + 1.0572252 * z;

        // 3. linear RGB → sRGB
        return new double[]{
                gammaCompress(rl) * 255.0,
                gammaCompress(gl) * 255.0,
                gammaCompress(bl) * 255.0
        };
    }

    /**
     * Encode CIELAB into the 8-bit scale [L8, A8, B8], all nominally in [0, 255].
     */
    public static double[] encodeLab(double[] lab) {
        return new double[]{lab[0] * L_SCALE, lab[1] + AB_OFFSET, lab[2] + AB_OFFSET};
    }

    /**
     * Decode the 8-bit scale back to CIELAB [L*, a*, b*].
     */
    public static double[] decodeLab(double l8, double a8, double b8) {
        return new double[]{l8 / L_SCALE, a8 - AB_OFFSET, b8 - AB_OFFSET};
    }

    /**
     * Round and clamp a sample to the valid 8-bit range.
     */
    public static int clampToByte(double value) {
        long rounded = Math.round(value);
        if (rounded < 0) return 0;
        if (rounded > 255) return 255;
        return (int) rounded;
    }

    private static double gammaExpand(double c) {
        return c <= 0.04045 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
    }

    private static double gammaCompress(double c) {
        if (c < 0.0) return -gammaCompress(-c);
        return c <= 0.0031308 ? c * 12.92 : 1.055 * Math.pow(c, 1.0 / 2.4) - 0.055;
    }

    private static double labF(double t) {
        return t > LAB_EPSILON ? Math.cbrt(t) : (LAB_KAPPA * t + 16.0) / 116.0;
    }

    private static double labFInverse(double f) {
        double f3 = f * f * f;
        return f3 > LAB_EPSILON ? f3 : (116.0 * f - 16.0) / LAB_KAPPA;
    }
}
