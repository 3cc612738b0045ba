package io.croissant.core.error;

/** Thrown when the content of a file object cannot be retrieved or fails its integrity check. */
public final class FetchException extends CroissantExecutionException {

    private static final long serialVersionUID = 1L;

    public FetchException(String message, String nodeUid, String operation) {
        super(message, nodeUid, operation);
    }

    public FetchException(String message, Throwable cause, String nodeUid, String operation) {
        super(message, cause, nodeUid, operation);
    }
}
