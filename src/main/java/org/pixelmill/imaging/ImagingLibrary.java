package org.pixelmill.imaging;

import org.pixelmill.exception.DecodeException;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Pixel-level operations used by the transform chain.
 * <p>
 * Every transform is a pure function: it never modifies its argument and returns either a fresh image or,
 * when the operation is a no-op, the argument itself. Transforms signal rejected input with unchecked
 * exceptions ({@link IllegalArgumentException}, {@link java.awt.image.ImagingOpException}).
 * Implementations must be safe to call from several threads at once.
 */
public interface ImagingLibrary {

    BufferedImage decode(byte[] data) throws DecodeException;

    /**
     * @param format  ImageIO format name such as {@code jpg} or {@code png}
     * @param quality compression quality in [0, 1], only used by lossy formats
     */
    byte[] encode(BufferedImage image, String format, float quality) throws IOException;

    BufferedImage resize(BufferedImage image, int width, int height);

    BufferedImage blur(BufferedImage image, double radius);

    BufferedImage sharpen(BufferedImage image, double factor);

    BufferedImage contrast(BufferedImage image, double factor);

    BufferedImage brightness(BufferedImage image, double factor);
}
