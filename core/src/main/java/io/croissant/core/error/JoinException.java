package io.croissant.core.error;

/** Thrown when a join cannot be performed: wrong operand count, missing reference or missing key column. */
public final class JoinException extends CroissantExecutionException {

    private static final long serialVersionUID = 1L;

    public JoinException(String message, String nodeUid, String operation) {
        super(message, nodeUid, operation);
    }

    public JoinException(String message, Throwable cause, String nodeUid, String operation) {
        super(message, cause, nodeUid, operation);
    }
}
