package io.croissant.core.error;

/** Thrown when a file cannot be parsed for its declared encoding format. */
public final class FileReadException extends CroissantExecutionException {

    private static final long serialVersionUID = 1L;

    public FileReadException(String message, String nodeUid, String operation) {
        super(message, nodeUid, operation);
    }

    public FileReadException(String message, Throwable cause, String nodeUid, String operation) {
        super(message, cause, nodeUid, operation);
    }
}
