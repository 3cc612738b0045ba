package io.croissant.core.issues;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Collects every error and warning of one validation pass. Nothing here throws: nodes append
 * their problems and the caller that owns the pass decides, once the pass is over, whether the
 * collected errors make the document invalid.
 *
 * <p>
 * Append-only and confined to the thread running the pass.
 */
public final class Issues implements Iterable<Issue> {

    private final List<Issue> issues = new ArrayList<>();

    public void error(Context context, String message) {
        issues.add(new Issue(Issue.Severity.ERROR, context, message));
    }

    public void warning(Context context, String message) {
        issues.add(new Issue(Issue.Severity.WARNING, context, message));
    }

    public boolean hasErrors() {
        return issues.stream().anyMatch(Issue::isError);
    }

    public List<Issue> errors() {
        return issues.stream().filter(Issue::isError).toList();
    }

    public List<Issue> warnings() {
        return issues.stream().filter(issue -> !issue.isError()).toList();
    }

    /** All issues in the order they were collected. */
    public List<Issue> all() {
        return Collections.unmodifiableList(issues);
    }

    public int size() {
        return issues.size();
    }

    @Override
    public Iterator<Issue> iterator() {
        return all().iterator();
    }

    /**
     * Renders the error issues as the body of an aggregate validation failure.
     *
     * @return a multi-line report, or an empty string when there is no error
     */
    public String report() {
        List<Issue> errors = errors();
        if (errors.isEmpty()) {
            return "";
        }
        StringBuilder report = new StringBuilder("Found the following ")
                .append(errors.size())
                .append(" error(s) during the validation:");
        for (Issue error : errors) {
            report.append("\n  -  ").append(error);
        }
        return report.toString();
    }
}
