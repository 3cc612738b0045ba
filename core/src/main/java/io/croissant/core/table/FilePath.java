package io.croissant.core.table;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A file selected while materializing a distribution.
 *
 * @param filepath absolute location of the file on the local disk
 * @param filename last path element
 * @param fullpath path relative to the root it was found under (an archive or the base directory)
 */
public record FilePath(Path filepath, String filename, Path fullpath) {

    public FilePath {
        Objects.requireNonNull(filepath, "filepath must not be null");
        Objects.requireNonNull(filename, "filename must not be null");
        Objects.requireNonNull(fullpath, "fullpath must not be null");
    }

    /** A file located relative to {@code root}. */
    public static FilePath of(Path root, Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        Path relative = root.toAbsolutePath().normalize().relativize(absolute);
        return new FilePath(absolute, absolute.getFileName().toString(), relative);
    }
}
