package io.croissant.core.error;

/** Thrown when a file set has no file to concatenate. */
public final class ConcatenateException extends CroissantExecutionException {

    private static final long serialVersionUID = 1L;

    public ConcatenateException(String message, String nodeUid, String operation) {
        super(message, nodeUid, operation);
    }

    public ConcatenateException(String message, Throwable cause, String nodeUid, String operation) {
        super(message, cause, nodeUid, operation);
    }
}
