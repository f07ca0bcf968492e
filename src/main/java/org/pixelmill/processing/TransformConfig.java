package org.pixelmill.processing;

/**
 * Parameters of the transform chain for one work item.
 *
 * @param iterationCount how many times the whole chain is applied; raised by the load amplifier to inflate CPU cost
 * @param blurRamp       when set, pass {@code i} of {@code n} blurs with {@code blurRadius * (i + 1) / n}
 */
public record TransformConfig(int resizeWidth, int resizeHeight, double blurRadius, double sharpenFactor,
                              double contrastFactor, double brightnessFactor, int iterationCount, boolean blurRamp) {

    public static final int DEFAULT_WIDTH = 800;
    public static final int DEFAULT_HEIGHT = 600;
    public static final double DEFAULT_BLUR_RADIUS = 2.0;
    public static final double DEFAULT_SHARPEN_FACTOR = 2.0;
    public static final double DEFAULT_CONTRAST_FACTOR = 1.5;
    public static final double DEFAULT_BRIGHTNESS_FACTOR = 1.2;

    public TransformConfig {
        if (resizeWidth < 1 || resizeHeight < 1)
            throw new IllegalArgumentException("Resize dimensions must be >= 1: " + resizeWidth + "x" + resizeHeight);
        if (!(blurRadius >= 0) || Double.isInfinite(blurRadius))
            throw new IllegalArgumentException("blurRadius must be a finite value >= 0: " + blurRadius);
        requireFactor("sharpenFactor", sharpenFactor);
        requireFactor("contrastFactor", contrastFactor);
        requireFactor("brightnessFactor", brightnessFactor);
        if (iterationCount < 1)
            throw new IllegalArgumentException("iterationCount must be >= 1: " + iterationCount);
    }

    public static TransformConfig defaults() {
        return new TransformConfig(DEFAULT_WIDTH, DEFAULT_HEIGHT, DEFAULT_BLUR_RADIUS, DEFAULT_SHARPEN_FACTOR,
                DEFAULT_CONTRAST_FACTOR, DEFAULT_BRIGHTNESS_FACTOR, 1, false);
    }

    public TransformConfig withIterationCount(int iterations) {
        return new TransformConfig(resizeWidth, resizeHeight, blurRadius, sharpenFactor, contrastFactor,
                brightnessFactor, iterations, blurRamp);
    }

    public TransformConfig withBlurRadius(double radius) {
        return new TransformConfig(resizeWidth, resizeHeight, radius, sharpenFactor, contrastFactor,
                brightnessFactor, iterationCount, blurRamp);
    }

    public TransformConfig withBlurRamp(boolean ramp) {
        return new TransformConfig(resizeWidth, resizeHeight, blurRadius, sharpenFactor, contrastFactor,
                brightnessFactor, iterationCount, ramp);
    }

    /**
     * Blur radius used on the given 0-based pass.
     */
    public double blurRadiusForPass(int pass) {
        return blurRamp ? blurRadius * (pass + 1) / iterationCount : blurRadius;
    }

    private static void requireFactor(String name, double value) {
        if (!(value >= 0) || Double.isInfinite(value))
            throw new IllegalArgumentException(name + " must be a finite value >= 0: " + value);
    }
}
