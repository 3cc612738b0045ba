package io.croissant.core.io;

import io.croissant.core.spi.Checksum;
import io.croissant.core.spi.FileFetcher;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link FileFetcher}. Local paths and {@code file:} URLs are resolved against the
 * document's base directory and read in place. {@code http(s)} URLs are downloaded once into the
 * cache directory, under a name derived from the URL, and verified against the declared digests
 * before they are kept.
 */
public final class CachingFileFetcher implements FileFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(CachingFileFetcher.class);

    private final Path baseDirectory;
    private final Path cacheDirectory;
    private final HttpClient httpClient;
    private final Duration timeout;

    public CachingFileFetcher(Path baseDirectory, Path cacheDirectory, Duration timeout) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory must not be null");
        this.cacheDirectory = Objects.requireNonNull(cacheDirectory, "cacheDirectory must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public Path fetch(String contentUrl, Checksum checksum) throws IOException {
        Objects.requireNonNull(contentUrl, "contentUrl must not be null");
        String scheme = schemeOf(contentUrl);
        if ("http".equals(scheme) || "https".equals(scheme)) {
            return download(URI.create(contentUrl), checksum);
        }
        Path local = "file".equals(scheme) ? Path.of(URI.create(contentUrl)) : baseDirectory.resolve(contentUrl);
        if (!Files.isRegularFile(local)) {
            throw new IOException("No such file: " + local);
        }
        return local;
    }

    private Path download(URI url, Checksum checksum) throws IOException {
        Path target = cacheDirectory.resolve("download").resolve(cacheName(url));
        if (Files.isRegularFile(target)) {
            LOG.debug("Cache hit: url={}, path={}", url, target);
            return target;
        }
        Files.createDirectories(target.getParent());
        Path partial = target.resolveSibling(target.getFileName() + ".part");
        HttpRequest request = HttpRequest.newBuilder(url).timeout(timeout).GET().build();
        long start = System.nanoTime();
        try {
            HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
            if (response.statusCode() / 100 != 2) {
                response.body().close();
                throw new IOException("HTTP " + response.statusCode() + " while downloading " + url);
            }
            MessageDigest md5 = digest("MD5");
            MessageDigest sha256 = digest("SHA-256");
            try (InputStream body = new DigestInputStream(new DigestInputStream(response.body(), md5), sha256)) {
                Files.copy(body, partial, StandardCopyOption.REPLACE_EXISTING);
            }
            verify("md5", checksum.md5(), md5, url);
            verify("sha256", checksum.sha256(), sha256, url);
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while downloading " + url, e);
        } finally {
            Files.deleteIfExists(partial);
        }
        LOG.info(
                "Downloaded: url={}, path={}, bytes={}, duration_ms={}",
                url,
                target,
                Files.size(target),
                (System.nanoTime() - start) / 1_000_000);
        return target;
    }

    private static void verify(String algorithm, String expected, MessageDigest digest, URI url) throws IOException {
        if (expected == null || expected.isBlank()) {
            return;
        }
        String actual = HexFormat.of().formatHex(digest.digest());
        if (!actual.equalsIgnoreCase(expected.trim())) {
            throw new IOException(
                    "Checksum mismatch for " + url + ": expected " + algorithm + "=" + expected + ", got " + actual);
        }
    }

    private static String cacheName(URI url) {
        String hash = HexFormat.of()
                .formatHex(digest("SHA-256").digest(url.toString().getBytes(StandardCharsets.UTF_8)));
        String path = url.getPath() == null ? "" : url.getPath();
        String last = path.substring(path.lastIndexOf('/') + 1);
        return last.isEmpty() ? hash : hash.substring(0, 16) + "-" + last;
    }

    private static MessageDigest digest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " is not available", e);
        }
    }

    private static String schemeOf(String contentUrl) {
        int colon = contentUrl.indexOf(':');
        // A single letter before the colon is a Windows drive, not a scheme.
        if (colon <= 1) {
            return null;
        }
        return contentUrl.substring(0, colon).toLowerCase(Locale.ROOT);
    }
}
