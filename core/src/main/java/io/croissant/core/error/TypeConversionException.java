package io.croissant.core.error;

/** Thrown when a value cannot be converted to the data type declared by its field. */
public final class TypeConversionException extends CroissantExecutionException {

    private static final long serialVersionUID = 1L;

    public TypeConversionException(String message, String nodeUid, String operation) {
        super(message, nodeUid, operation);
    }

    public TypeConversionException(String message, Throwable cause, String nodeUid, String operation) {
        super(message, cause, nodeUid, operation);
    }
}
