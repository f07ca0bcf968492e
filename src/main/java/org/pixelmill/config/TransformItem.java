package org.pixelmill.config;

import org.pixelmill.processing.TransformConfig;

/**
 * Transform section of the YAML configuration. Absent values fall back to {@link TransformConfig#defaults()}.
 */
public record TransformItem(Integer resizeWidth, Integer resizeHeight, Double blurRadius, Double sharpenFactor,
                            Double contrastFactor, Double brightnessFactor, Integer iterations, Boolean blurRamp) {

    public TransformConfig toTransformConfig() {
        return new TransformConfig(
                resizeWidth != null ? resizeWidth : TransformConfig.DEFAULT_WIDTH,
                resizeHeight != null ? resizeHeight : TransformConfig.DEFAULT_HEIGHT,
                blurRadius != null ? blurRadius : TransformConfig.DEFAULT_BLUR_RADIUS,
                sharpenFactor != null ? sharpenFactor : TransformConfig.DEFAULT_SHARPEN_FACTOR,
                contrastFactor != null ? contrastFactor : TransformConfig.DEFAULT_CONTRAST_FACTOR,
                brightnessFactor != null ? brightnessFactor : TransformConfig.DEFAULT_BRIGHTNESS_FACTOR,
                iterations != null ? iterations : 1,
                blurRamp != null && blurRamp);
    }
}
