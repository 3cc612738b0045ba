package io.croissant.core.error;

/**
 * Abstract parent for errors raised while a metadata document is read and validated. Carries the
 * location of the document so a caller can report which file was rejected.
 */
public abstract class CroissantLoadException extends CroissantException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected CroissantLoadException(String message, String nodeUid, String source) {
        super(message, nodeUid, Phase.LOAD);
        this.source = source;
    }

    protected CroissantLoadException(String message, Throwable cause, String nodeUid, String source) {
        super(message, cause, nodeUid, Phase.LOAD);
        this.source = source;
    }

    /** The document path or description, or {@code null} for in-memory documents. */
    public String source() {
        return source;
    }
}
