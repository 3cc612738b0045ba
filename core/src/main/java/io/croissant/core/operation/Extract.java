package io.croissant.core.operation;

import io.croissant.core.error.FileReadException;
import io.croissant.core.model.FileObject;
import io.croissant.core.table.FilePath;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unpacks a zip archive into the cache directory. Outputs every extracted file, relative to the
 * extraction root, sorted by path.
 */
public final class Extract extends Operation {

    private static final Logger LOG = LoggerFactory.getLogger(Extract.class);

    private final Path cacheDirectory;

    public Extract(FileObject archive, Path cacheDirectory) {
        super(archive);
        this.cacheDirectory = cacheDirectory;
    }

    @Override
    public List<FilePath> call(List<Object> inputs) {
        List<FilePath> archives = filePaths(inputs, cacheDirectory);
        List<FilePath> extracted = new ArrayList<>();
        for (FilePath archive : archives) {
            Path root = cacheDirectory.resolve("extract").resolve(directoryName(archive.filepath()));
            try {
                if (!Files.isDirectory(root)) {
                    unzip(archive.filepath(), root);
                }
                try (Stream<Path> files = Files.walk(root)) {
                    files.filter(Files::isRegularFile)
                            .sorted(Comparator.naturalOrder())
                            .forEach(file -> extracted.add(FilePath.of(root, file)));
                }
            } catch (IOException e) {
                throw new FileReadException(
                        "Cannot extract " + archive.filepath() + ": " + e.getMessage(), e, node().uid(), name());
            }
        }
        LOG.debug("Extracted: node={}, archives={}, files={}", node().uid(), archives.size(), extracted.size());
        return extracted;
    }

    private static void unzip(Path archive, Path root) throws IOException {
        Path staging = Files.createDirectories(root.resolveSibling(root.getFileName() + ".part"));
        int entries = 0;
        try (ZipInputStream zip = new ZipInputStream(Files.newInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                entries++;
                Path target = staging.resolve(entry.getName()).normalize();
                if (!target.startsWith(staging)) {
                    throw new ZipException("Entry escapes the extraction directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else {
                    Files.createDirectories(target.getParent());
                    Files.copy(zip, target, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        }
        if (entries == 0) {
            throw new ZipException("Not a zip archive or empty archive: " + archive);
        }
        Files.move(staging, root, StandardCopyOption.ATOMIC_MOVE);
    }

    // The same archive location always maps to the same directory.
    private static String directoryName(Path archive) {
        byte[] location = archive.toAbsolutePath().normalize().toString().getBytes(StandardCharsets.UTF_8);
        try {
            String hash = HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(location));
            return hash.substring(0, 16) + "-" + archive.getFileName();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
