package io.croissant.core.operation;

import io.croissant.core.error.FileReadException;
import io.croissant.core.model.Distribution;
import io.croissant.core.table.FilePath;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Keeps the files whose path relative to their root matches one of the glob patterns.
 *
 * <p>
 * The candidates are the files received as inputs (extracted archives). A distribution that is
 * not contained in any archive has no inputs, and its candidates are the files under the base
 * directory instead. Outputs the matching files sorted by relative path.
 */
public final class FilterFiles extends Operation {

    private final List<String> patterns;
    private final List<PathMatcher> matchers;
    private final Path scanRoot;

    /**
     * @param scanRoot directory to list when the distribution is not contained in an archive,
     *                 {@code null} otherwise
     */
    public FilterFiles(Distribution distribution, List<String> patterns, Path scanRoot) {
        super(distribution);
        this.patterns = List.copyOf(patterns);
        this.matchers = this.patterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
        this.scanRoot = scanRoot;
    }

    public List<String> patterns() {
        return patterns;
    }

    @Override
    public List<FilePath> call(List<Object> inputs) {
        List<FilePath> candidates = scanRoot == null ? filePaths(inputs, Path.of("")) : scan(scanRoot);
        return candidates.stream()
                .filter(file -> matchers.stream().anyMatch(matcher -> matcher.matches(file.fullpath())))
                .sorted(Comparator.comparing(FilePath::fullpath))
                .toList();
    }

    private List<FilePath> scan(Path root) {
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile).map(file -> FilePath.of(root, file)).toList();
        } catch (IOException e) {
            throw new FileReadException("Cannot list " + root + ": " + e.getMessage(), e, node().uid(), name());
        }
    }
}
