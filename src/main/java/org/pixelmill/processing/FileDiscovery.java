package org.pixelmill.processing;

import org.pixelmill.exception.AccessException;
import org.pixelmill.util.Utils;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Lists the image files of a directory in a single pass.
 * <p>
 * Only the directory's immediate entries are considered. A symbolic link to a regular file is included;
 * links to directories are never descended, so link cycles cannot occur.
 */
public final class FileDiscovery {

    private static final Logger LOGGER = Logger.getLogger(FileDiscovery.class.getName());

    private FileDiscovery() {
    }

    /**
     * @param extensions recognized extensions, matched case-insensitively ({@code ".jpg"}, {@code "png"}, ...)
     * @return matching files sorted by file name; empty when nothing matches
     * @throws AccessException when {@code root} is missing, not a directory, or cannot be listed
     */
    public static List<Path> discover(final Path root, final Collection<String> extensions) throws AccessException {
        if (!Files.isDirectory(root)) throw new AccessException(root, "Input directory not found");
        if (!Files.isReadable(root)) throw new AccessException(root, "Input directory is not readable");

        final Set<String> accepted = extensions.stream().map(Utils::normalizeExtension).collect(Collectors.toSet());
        final List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(root)) {
            for (Path entry : stream) {
                if (accepted.contains(Utils.extensionOf(entry)) && Files.isRegularFile(entry)) files.add(entry);
            }
        } catch (IOException e) {
            throw new AccessException(root, "Failed to list input directory", e);
        }
        files.sort(Comparator.comparing(p -> p.getFileName().toString()));
        LOGGER.fine(() -> "Discovered %d image(s) in %s".formatted(files.size(), root));
        return files;
    }
}
