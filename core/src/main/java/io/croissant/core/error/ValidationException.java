package io.croissant.core.error;

import io.croissant.core.issues.Issue;
import java.util.List;

/**
 * Aggregate failure of a validation pass. The message lists every error issue, one per line, each
 * prefixed with the breadcrumb of the node it belongs to.
 */
public final class ValidationException extends CroissantLoadException {

    private static final long serialVersionUID = 1L;

    private final transient List<Issue> issues;

    public ValidationException(String message, List<Issue> issues, String source) {
        super(message, null, source);
        this.issues = List.copyOf(issues);
    }

    /** Every issue collected during the pass, errors and warnings, in collection order. */
    public List<Issue> issues() {
        return issues;
    }
}
