package org.pixelmill.util;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class TestDataGenerator {

    private TestDataGenerator() {
        // Prevent instantiation
    }

    /**
     * Deterministic gradient image; different seeds give different pixels.
     */
    public static BufferedImage gradient(int width, int height, int seed) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int r = (x * 255 / Math.max(1, width - 1) + seed * 37) & 0xff;
                int g = (y * 255 / Math.max(1, height - 1) + seed * 11) & 0xff;
                int b = ((x + y) * 7 + seed * 53) & 0xff;
                image.setRGB(x, y, (r << 16) | (g << 8) | b);
            }
        }
        return image;
    }

    public static Path writeImage(Path file, int width, int height, int seed) {
        String name = file.getFileName().toString();
        String format = name.substring(name.lastIndexOf('.') + 1).toLowerCase();
        if (format.equals("jpeg")) format = "jpg";
        try {
            Files.createDirectories(file.getParent());
            if (!ImageIO.write(gradient(width, height, seed), format, file.toFile()))
                throw new IOException("No writer for " + format);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return file;
    }

    /**
     * Writes {@code count} images named {@code image_01.png}, {@code image_02.png}, ...
     */
    public static List<Path> createImages(Path dir, int count, String extension) {
        List<Path> files = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            files.add(writeImage(dir.resolve("image_%02d%s".formatted(i, extension)), 40, 30, i));
        }
        return files;
    }

    /**
     * A file with an image extension whose bytes no decoder accepts.
     */
    public static Path createCorruptImage(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        return Files.write(file, "definitely not an image".getBytes());
    }
}
