package org.pixelmill.processing;

import org.pixelmill.util.Utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Builds stress-test workloads: inflates a set of base images to a target item count and scales the number of
 * chain passes per image.
 * <p>
 * Duplication is referential. Extra items point at the same source file under a distinct destination name,
 * so base images are never copied, modified or deleted. {@link #materialize} produces real copies in a separate
 * staging directory when a caller needs them.
 */
public class LoadAmplifier {

    private static final Logger LOGGER = Logger.getLogger(LoadAmplifier.class.getName());

    private final Path outputDir;
    private final String outputPrefix;
    private final TransformConfig baseConfig;

    public LoadAmplifier(final Path outputDir, final String outputPrefix, final TransformConfig baseConfig) {
        this.outputDir = Objects.requireNonNull(outputDir);
        this.outputPrefix = Objects.requireNonNull(outputPrefix);
        this.baseConfig = Objects.requireNonNull(baseConfig);
    }

    /**
     * Produces exactly {@code targetCount} items.
     * <p>
     * When there are at least {@code targetCount} base images the first {@code targetCount} are used in order.
     * Otherwise all base images are used, followed by round-robin duplicates {@code base[i % n]} for
     * {@code i = n .. targetCount - 1}, named {@code dup_<i+1>_<stem><ext>}.
     *
     * @param iterationMultiplier chain passes for every produced item
     */
    public List<WorkItem> amplify(final List<Path> baseImages, final int targetCount, final int iterationMultiplier) {
        if (targetCount < 0) throw new IllegalArgumentException("targetCount must be >= 0: " + targetCount);
        if (targetCount > 0 && baseImages.isEmpty())
            throw new IllegalArgumentException("Cannot amplify an empty image set to " + targetCount + " items");
        final TransformConfig config = baseConfig.withIterationCount(iterationMultiplier);

        final int originalCount = baseImages.size();
        final List<WorkItem> items = new ArrayList<>(targetCount);
        for (int i = 0; i < Math.min(originalCount, targetCount); i++) {
            final Path source = baseImages.get(i);
            items.add(new WorkItem(source, outputDir.resolve(outputPrefix + source.getFileName()), config));
        }
        if (originalCount < targetCount) {
            LOGGER.info("Duplicating images to create %d test items...".formatted(targetCount));
            for (int i = originalCount; i < targetCount; i++) {
                final Path source = baseImages.get(i % originalCount);
                items.add(new WorkItem(source, outputDir.resolve(outputPrefix + duplicateName(i, source)), config));
            }
        }
        return items;
    }

    /**
     * Copies the source of every repeated item into {@code stagingDir} and points the item at the copy.
     * The first item referencing a source keeps the original path.
     *
     * @throws IllegalArgumentException when the staging directory holds one of the base images
     */
    public List<WorkItem> materialize(final List<WorkItem> items, final Path stagingDir) throws IOException {
        final Path staging = stagingDir.toAbsolutePath().normalize();
        for (WorkItem item : items) {
            final Path parent = item.sourcePath().toAbsolutePath().normalize().getParent();
            if (staging.equals(parent))
                throw new IllegalArgumentException("Staging directory must differ from the input directory: " + stagingDir);
        }
        Files.createDirectories(staging);

        final Set<Path> seen = new HashSet<>();
        final List<WorkItem> result = new ArrayList<>(items.size());
        for (WorkItem item : items) {
            if (seen.add(item.sourcePath())) {
                result.add(item);
                continue;
            }
            final String name = item.destinationPath().getFileName().toString();
            final Path copy = staging.resolve(name.startsWith(outputPrefix) ? name.substring(outputPrefix.length()) : name);
            Files.copy(item.sourcePath(), copy, StandardCopyOption.REPLACE_EXISTING);
            LOGGER.fine(() -> "Created duplicate: " + copy.getFileName());
            result.add(new WorkItem(copy, item.destinationPath(), item.transformConfig()));
        }
        return result;
    }

    static String duplicateName(final int index, final Path source) {
        final String stem = Utils.stemOf(source);
        final String extension = source.getFileName().toString().substring(stem.length());
        return "dup_%03d_%s%s".formatted(index + 1, stem, extension);
    }
}
