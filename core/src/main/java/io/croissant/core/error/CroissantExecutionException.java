package io.croissant.core.error;

/**
 * Abstract parent for errors raised while the operation graph runs. These are fatal to the run
 * that triggers them: they are neither retried nor aggregated.
 */
public abstract class CroissantExecutionException extends CroissantException {

    private static final long serialVersionUID = 1L;

    private final String operation;

    protected CroissantExecutionException(String message, String nodeUid, String operation) {
        super(message, nodeUid, Phase.EXECUTION);
        this.operation = operation;
    }

    protected CroissantExecutionException(String message, Throwable cause, String nodeUid, String operation) {
        super(message, cause, nodeUid, Phase.EXECUTION);
        this.operation = operation;
    }

    /** The name of the failing operation, or {@code null} outside of an operation. */
    public String operation() {
        return operation;
    }
}
