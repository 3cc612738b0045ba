package io.croissant.core.spi;

/**
 * Integrity digests declared by a file object, as lowercase hex strings.
 *
 * @param md5    MD5 digest, or {@code null}
 * @param sha256 SHA-256 digest, or {@code null}
 */
public record Checksum(String md5, String sha256) {

    public static final Checksum NONE = new Checksum(null, null);

    public boolean isEmpty() {
        return md5 == null && sha256 == null;
    }
}
