package io.croissant.core.error;

/** Thrown when an operation reads a column that the table it receives does not have. */
public final class MissingColumnException extends CroissantExecutionException {

    private static final long serialVersionUID = 1L;

    public MissingColumnException(String message, String nodeUid, String operation) {
        super(message, nodeUid, operation);
    }

    public MissingColumnException(String message, Throwable cause, String nodeUid, String operation) {
        super(message, cause, nodeUid, operation);
    }
}
