package io.croissant.core.io;

import io.croissant.core.spi.FormatReader;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of format readers keyed by encoding format. Formats without a registered reader are
 * read as opaque bytes by the fallback reader. Thread-safe.
 */
public final class FormatReaderRegistry {

    private final Map<String, FormatReader> readers = new ConcurrentHashMap<>();
    private final FormatReader fallback;

    public FormatReaderRegistry(FormatReader fallback) {
        this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
    }

    /** A registry with the built-in CSV, JSON, JSON Lines and text readers, falling back to bytes. */
    public static FormatReaderRegistry defaults() {
        FormatReaderRegistry registry = new FormatReaderRegistry(new BinaryFormatReader());
        registry.register(new CsvFormatReader());
        registry.register(new JsonFormatReader());
        registry.register(new JsonLinesFormatReader());
        registry.register(new TextFormatReader());
        return registry;
    }

    /**
     * Registers a reader for every format it declares. A format already registered is taken over
     * (last-write-wins).
     */
    public void register(FormatReader reader) {
        Objects.requireNonNull(reader, "reader must not be null");
        for (String format : reader.encodingFormats()) {
            readers.put(normalize(format), reader);
        }
    }

    /** The reader for {@code encodingFormat}, or the fallback reader. */
    public FormatReader reader(String encodingFormat) {
        if (encodingFormat == null) {
            return fallback;
        }
        return readers.getOrDefault(normalize(encodingFormat), fallback);
    }

    public boolean hasReader(String encodingFormat) {
        return encodingFormat != null && readers.containsKey(normalize(encodingFormat));
    }

    // Parameters such as "; charset=utf-8" do not change the reader.
    private static String normalize(String format) {
        int semicolon = format.indexOf(';');
        String type = semicolon >= 0 ? format.substring(0, semicolon) : format;
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
