package io.croissant.core.error;

/** Thrown when a metadata document cannot be read or is not a JSON object. */
public final class DocumentParseException extends CroissantLoadException {

    private static final long serialVersionUID = 1L;

    public DocumentParseException(String message, String source) {
        super(message, null, source);
    }

    public DocumentParseException(String message, Throwable cause, String source) {
        super(message, cause, null, source);
    }
}
