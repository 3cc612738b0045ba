package io.croissant.core.error;

/**
 * Abstract base for all croissant exceptions. Never thrown directly; use the concrete subclasses
 * under {@link CroissantLoadException} or {@link CroissantExecutionException}.
 */
public abstract class CroissantException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        EXECUTION
    }

    private final String nodeUid;
    private final Phase phase;

    protected CroissantException(String message, String nodeUid, Phase phase) {
        super(message);
        this.nodeUid = nodeUid;
        this.phase = phase;
    }

    protected CroissantException(String message, Throwable cause, String nodeUid, Phase phase) {
        super(message, cause);
        this.nodeUid = nodeUid;
        this.phase = phase;
    }

    /** The node that triggered the error, or {@code null} if not attributable to one node. */
    public String nodeUid() {
        return nodeUid;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
