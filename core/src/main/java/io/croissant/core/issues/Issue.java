package io.croissant.core.issues;

import java.util.Objects;

/**
 * A single validation problem found in a metadata document.
 *
 * @param severity whether the problem fails validation
 * @param context  breadcrumb of the node the problem belongs to
 * @param message  human-readable cause
 */
public record Issue(Severity severity, Context context, String message) {

    /** Errors fail validation; warnings are only reported. */
    public enum Severity {
        ERROR,
        WARNING
    }

    public Issue {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return context + " " + message;
    }
}
