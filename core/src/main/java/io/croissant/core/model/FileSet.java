package io.croissant.core.model;

import io.croissant.core.issues.Context;
import io.croissant.core.issues.Issues;
import java.util.List;

/**
 * A set of files selected by glob patterns, either inside the archives it is contained in or,
 * when top-level, under the document's base directory.
 */
public record FileSet(
        String uid,
        String name,
        String description,
        List<String> includes,
        String encodingFormat,
        List<String> containedIn,
        String parentUid,
        Context context)
        implements Distribution {

    public FileSet {
        includes = List.copyOf(includes);
        containedIn = List.copyOf(containedIn);
    }

    @Override
    public NodeType type() {
        return NodeType.FILE_SET;
    }

    @Override
    public void check(Issues issues) {
        Checks.mandatory(issues, context, Terms.INCLUDES, includes);
        Checks.mandatory(issues, context, Terms.ENCODING_FORMAT, encodingFormat);
        Checks.mandatory(issues, context, Terms.NAME, name);
        Checks.recommended(issues, context, Terms.DESCRIPTION, description);
    }
}
