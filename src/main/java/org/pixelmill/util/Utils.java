package org.pixelmill.util;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Small helpers for file names and report formatting.
 */
public final class Utils {

    private Utils() {
    }

    /**
     * Lower-cased extension including the dot ({@code ".jpg"}), or an empty string when the name has none.
     */
    public static String extensionOf(final Path path) {
        final String name = path.getFileName().toString();
        final int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    /**
     * File name without its extension.
     */
    public static String stemOf(final Path path) {
        final String name = path.getFileName().toString();
        final int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }

    /**
     * Normalizes an extension to the {@code ".ext"} lower-case form, accepting {@code "JPG"}, {@code ".Jpg"} or {@code "*.jpg"}.
     */
    public static String normalizeExtension(final String extension) {
        String ext = extension.trim().toLowerCase(Locale.ROOT);
        if (ext.startsWith("*")) ext = ext.substring(1);
        return ext.startsWith(".") ? ext : "." + ext;
    }

    public static String formatSeconds(final Duration duration) {
        return String.format(Locale.ROOT, "%.2f", duration.toNanos() / 1_000_000_000.0);
    }

    public static String escapeCsvField(String field) {
        if (field == null) {
            return "";
        } else {
            boolean mustQuote = field.contains(",") || field.contains("\"") || field.contains("\n") || field.contains("\r");
            String escaped = field.replace("\"", "\"\"");
            return mustQuote ? "\"" + escaped + "\"" : escaped;
        }
    }
}
