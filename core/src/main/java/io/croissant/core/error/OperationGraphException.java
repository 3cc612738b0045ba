package io.croissant.core.error;

/** Thrown when the operation graph is internally inconsistent, e.g. it contains a cycle. */
public final class OperationGraphException extends CroissantExecutionException {

    private static final long serialVersionUID = 1L;

    public OperationGraphException(String message, String nodeUid, String operation) {
        super(message, nodeUid, operation);
    }

    public OperationGraphException(String message, Throwable cause, String nodeUid, String operation) {
        super(message, cause, nodeUid, operation);
    }
}
