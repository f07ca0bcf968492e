package org.pixelmill.imaging;

import org.pixelmill.exception.DecodeException;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;

/**
 * {@link ImagingLibrary} on top of {@code java.awt.image} and {@code javax.imageio}.
 * <p>
 * Images are normalized to {@code TYPE_INT_RGB} or {@code TYPE_INT_ARGB} on decode. Enhancement operations
 * follow the usual "blend against a degenerate image" model: sharpness blends with a smoothed copy,
 * contrast with the mean grey level and brightness with black. Alpha is carried through unchanged.
 */
public class AwtImagingLibrary implements ImagingLibrary {

    // 3x3 smoothing kernel used as the degenerate image for sharpening
    private static final int[] SMOOTH_KERNEL = {1, 1, 1, 1, 5, 1, 1, 1, 1};
    private static final int SMOOTH_SCALE = 13;

    @Override
    public BufferedImage decode(byte[] data) throws DecodeException {
        if (data == null || data.length == 0) throw new DecodeException("Empty image data");
        final BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(data));
        } catch (IOException | RuntimeException e) {
            throw new DecodeException("Corrupt image data: " + e.getMessage(), e);
        }
        if (image == null) throw new DecodeException("Unrecognized image format");
        return toWorkingType(image);
    }

    @Override
    public byte[] encode(BufferedImage image, String format, float quality) throws IOException {
        final String fmt = format.toLowerCase(Locale.ROOT);
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (fmt.equals("jpg") || fmt.equals("jpeg")) {
            writeJpeg(convert(image, BufferedImage.TYPE_INT_RGB), quality, out);
        } else {
            // BMP cannot hold an alpha channel
            BufferedImage toWrite = fmt.equals("bmp") ? convert(image, BufferedImage.TYPE_INT_RGB) : image;
            if (!ImageIO.write(toWrite, fmt, out))
                throw new IOException("No image writer available for format " + format);
        }
        return out.toByteArray();
    }

    @Override
    public BufferedImage resize(BufferedImage image, int width, int height) {
        if (width < 1 || height < 1)
            throw new IllegalArgumentException("Resize dimensions must be positive: " + width + "x" + height);
        final BufferedImage resized = new BufferedImage(width, height, workingTypeOf(image));
        final Graphics2D g = resized.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(image, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return resized;
    }

    @Override
    public BufferedImage blur(BufferedImage image, double radius) {
        if (radius < 0 || Double.isNaN(radius)) throw new IllegalArgumentException("Blur radius must be >= 0: " + radius);
        if (radius == 0) return image;

        final float[] kernel = gaussianKernel(radius);
        final int w = image.getWidth(), h = image.getHeight();
        final int[] src = pixels(image);
        final int[] tmp = new int[src.length];
        final int[] dst = new int[src.length];
        convolve1d(src, tmp, w, h, kernel, true);
        convolve1d(tmp, dst, w, h, kernel, false);
        return withPixels(image, dst);
    }

    @Override
    public BufferedImage sharpen(BufferedImage image, double factor) {
        checkFactor("Sharpen", factor);
        final int w = image.getWidth(), h = image.getHeight();
        final int[] src = pixels(image);
        final int[] smooth = src.clone();
        // Border pixels keep their original value
        for (int y = 1; y < h - 1; y++) {
            for (int x = 1; x < w - 1; x++) {
                int r = 0, g = 0, b = 0, k = 0;
                for (int dy = -1; dy <= 1; dy++) {
                    for (int dx = -1; dx <= 1; dx++) {
                        final int p = src[(y + dy) * w + (x + dx)];
                        final int weight = SMOOTH_KERNEL[k++];
                        r += ((p >> 16) & 0xff) * weight;
                        g += ((p >> 8) & 0xff) * weight;
                        b += (p & 0xff) * weight;
                    }
                }
                final int alpha = src[y * w + x] & 0xff000000;
                smooth[y * w + x] = alpha | (round(r, SMOOTH_SCALE) << 16) | (round(g, SMOOTH_SCALE) << 8) | round(b, SMOOTH_SCALE);
            }
        }
        return withPixels(image, blend(smooth, src, factor));
    }

    @Override
    public BufferedImage contrast(BufferedImage image, double factor) {
        checkFactor("Contrast", factor);
        final int[] src = pixels(image);
        long sum = 0;
        for (int p : src) {
            sum += (((p >> 16) & 0xff) * 299L + ((p >> 8) & 0xff) * 587L + (p & 0xff) * 114L);
        }
        final int mean = src.length == 0 ? 0 : (int) Math.round(sum / (1000.0 * src.length));
        final int grey = (mean << 16) | (mean << 8) | mean;
        final int[] degenerate = new int[src.length];
        for (int i = 0; i < src.length; i++) degenerate[i] = (src[i] & 0xff000000) | grey;
        return withPixels(image, blend(degenerate, src, factor));
    }

    @Override
    public BufferedImage brightness(BufferedImage image, double factor) {
        checkFactor("Brightness", factor);
        final int[] src = pixels(image);
        final int[] black = new int[src.length];
        for (int i = 0; i < src.length; i++) black[i] = src[i] & 0xff000000;
        return withPixels(image, blend(black, src, factor));
    }

    // --- helpers ---

    static BufferedImage toWorkingType(BufferedImage image) {
        final int type = image.getType();
        if (type == BufferedImage.TYPE_INT_RGB || type == BufferedImage.TYPE_INT_ARGB) return image;
        return convert(image, workingTypeOf(image));
    }

    private static int workingTypeOf(BufferedImage image) {
        return image.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
    }

    private static BufferedImage convert(BufferedImage image, int type) {
        if (image.getType() == type) return image;
        final BufferedImage converted = new BufferedImage(image.getWidth(), image.getHeight(), type);
        final Graphics2D g = converted.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return converted;
    }

    private static void writeJpeg(BufferedImage image, float quality, ByteArrayOutputStream out) throws IOException {
        final Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpg");
        if (!writers.hasNext()) throw new IOException("No JPEG writer available");
        final ImageWriter writer = writers.next();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            final ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(Math.max(0f, Math.min(1f, quality)));
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
    }

    private static int[] pixels(BufferedImage image) {
        final int w = image.getWidth(), h = image.getHeight();
        return image.getRGB(0, 0, w, h, null, 0, w);
    }

    private static BufferedImage withPixels(BufferedImage like, int[] data) {
        final int w = like.getWidth(), h = like.getHeight();
        final BufferedImage out = new BufferedImage(w, h, workingTypeOf(like));
        out.setRGB(0, 0, w, h, data, 0, w);
        return out;
    }

    /**
     * out = degenerate + factor * (image - degenerate), per colour channel, clamped; alpha comes from the image.
     */
    private static int[] blend(int[] degenerate, int[] image, double factor) {
        final int[] out = new int[image.length];
        for (int i = 0; i < image.length; i++) {
            final int d = degenerate[i], p = image[i];
            final int r = clamp(((d >> 16) & 0xff) + factor * (((p >> 16) & 0xff) - ((d >> 16) & 0xff)));
            final int g = clamp(((d >> 8) & 0xff) + factor * (((p >> 8) & 0xff) - ((d >> 8) & 0xff)));
            final int b = clamp((d & 0xff) + factor * ((p & 0xff) - (d & 0xff)));
            out[i] = (p & 0xff000000) | (r << 16) | (g << 8) | b;
        }
        return out;
    }

    private static float[] gaussianKernel(double sigma) {
        final int half = (int) Math.ceil(sigma * 3);
        final float[] kernel = new float[2 * half + 1];
        double total = 0;
        for (int i = -half; i <= half; i++) {
            final double v = Math.exp(-(i * i) / (2 * sigma * sigma));
            kernel[i + half] = (float) v;
            total += v;
        }
        for (int i = 0; i < kernel.length; i++) kernel[i] = (float) (kernel[i] / total);
        return kernel;
    }

    // One pass of a separable convolution with clamped edges; alpha is copied from the centre pixel.
    private static void convolve1d(int[] src, int[] dst, int w, int h, float[] kernel, boolean horizontal) {
        final int half = kernel.length / 2;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                float r = 0, g = 0, b = 0;
                for (int k = -half; k <= half; k++) {
                    final int sx = horizontal ? Math.min(w - 1, Math.max(0, x + k)) : x;
                    final int sy = horizontal ? y : Math.min(h - 1, Math.max(0, y + k));
                    final int p = src[sy * w + sx];
                    final float weight = kernel[k + half];
                    r += ((p >> 16) & 0xff) * weight;
                    g += ((p >> 8) & 0xff) * weight;
                    b += (p & 0xff) * weight;
                }
                dst[y * w + x] = (src[y * w + x] & 0xff000000) | (clamp(r) << 16) | (clamp(g) << 8) | clamp(b);
            }
        }
    }

    private static void checkFactor(String stage, double factor) {
        if (factor < 0 || Double.isNaN(factor) || Double.isInfinite(factor))
            throw new IllegalArgumentException(stage + " factor must be a finite value >= 0: " + factor);
    }

    private static int round(int sum, int scale) {
        return (sum + scale / 2) / scale;
    }

    private static int clamp(double v) {
        final long rounded = Math.round(v);
        return (int) Math.max(0, Math.min(255, rounded));
    }
}
