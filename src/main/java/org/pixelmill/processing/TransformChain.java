package org.pixelmill.processing;

import org.pixelmill.exception.TransformException;
import org.pixelmill.imaging.ImagingLibrary;

import java.awt.image.BufferedImage;
import java.awt.image.ImagingOpException;
import java.awt.image.RasterFormatException;
import java.util.List;
import java.util.Objects;

/**
 * Applies Resize, Blur, Sharpen, Contrast and Brightness, in that order, {@code iterationCount} times.
 * <p>
 * Each stage's output is handed straight to the next stage; nothing is copied in between. Repeated passes
 * compound the effect on the same running image.
 */
public final class TransformChain {

    private final ImagingLibrary imaging;
    private final TransformConfig config;

    public TransformChain(final ImagingLibrary imaging, final TransformConfig config) {
        this.imaging = Objects.requireNonNull(imaging);
        this.config = Objects.requireNonNull(config);
    }

    /**
     * Stages of the first pass.
     */
    public List<TransformStage> stages() {
        return stagesForPass(0);
    }

    /**
     * Stages of the given 0-based pass; only the blur radius varies between passes, and only with a blur ramp.
     */
    public List<TransformStage> stagesForPass(final int pass) {
        return List.of(
                new TransformStage.Resize(config.resizeWidth(), config.resizeHeight()),
                new TransformStage.Blur(config.blurRadiusForPass(pass)),
                new TransformStage.Sharpen(config.sharpenFactor()),
                new TransformStage.Contrast(config.contrastFactor()),
                new TransformStage.Brightness(config.brightnessFactor()));
    }

    /**
     * Runs every pass. The first rejected stage aborts the whole chain.
     *
     * @throws TransformException naming the stage that rejected its input
     */
    public BufferedImage apply(final BufferedImage input) throws TransformException {
        BufferedImage image = input;
        for (int pass = 0; pass < config.iterationCount(); pass++) {
            for (TransformStage stage : stagesForPass(pass)) {
                image = runStage(stage, image);
            }
        }
        return image;
    }

    private BufferedImage runStage(final TransformStage stage, final BufferedImage image) throws TransformException {
        final BufferedImage out;
        try {
            out = applyStage(imaging, stage, image);
        } catch (IllegalArgumentException | ImagingOpException | RasterFormatException e) {
            throw new TransformException(stage.name(), e);
        }
        if (out == null) throw new TransformException(stage.name(), new IllegalStateException("stage produced no image"));
        return out;
    }

    /**
     * Dispatches one stage variant to the matching imaging operation.
     */
    public static BufferedImage applyStage(final ImagingLibrary imaging, final TransformStage stage, final BufferedImage image) {
        if (stage instanceof TransformStage.Resize r) return imaging.resize(image, r.width(), r.height());
        if (stage instanceof TransformStage.Blur b) return imaging.blur(image, b.radius());
        if (stage instanceof TransformStage.Sharpen s) return imaging.sharpen(image, s.factor());
        if (stage instanceof TransformStage.Contrast c) return imaging.contrast(image, c.factor());
        if (stage instanceof TransformStage.Brightness br) return imaging.brightness(image, br.factor());
        throw new IllegalStateException("Unknown stage " + stage);
    }
}
