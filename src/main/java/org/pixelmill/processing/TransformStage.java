package org.pixelmill.processing;

/**
 * One step of the transform chain. Each variant carries only its own parameters;
 * {@link TransformChain#applyStage} is the single place that maps a variant onto the imaging library.
 */
public sealed interface TransformStage
        permits TransformStage.Resize, TransformStage.Blur, TransformStage.Sharpen,
        TransformStage.Contrast, TransformStage.Brightness {

    String name();

    record Resize(int width, int height) implements TransformStage {
        @Override
        public String name() {
            return "Resize";
        }
    }

    record Blur(double radius) implements TransformStage {
        @Override
        public String name() {
            return "Blur";
        }
    }

    record Sharpen(double factor) implements TransformStage {
        @Override
        public String name() {
            return "Sharpen";
        }
    }

    record Contrast(double factor) implements TransformStage {
        @Override
        public String name() {
            return "Contrast";
        }
    }

    record Brightness(double factor) implements TransformStage {
        @Override
        public String name() {
            return "Brightness";
        }
    }
}
