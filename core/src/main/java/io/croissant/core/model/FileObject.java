package io.croissant.core.model;

import io.croissant.core.issues.Context;
import io.croissant.core.issues.Issues;
import java.util.List;

/**
 * A single downloadable file. When {@link #containedIn()} is set, {@link #contentUrl()} is the
 * path of the file inside the containing archive.
 */
public record FileObject(
        String uid,
        String name,
        String description,
        String contentUrl,
        String contentSize,
        String encodingFormat,
        String md5,
        String sha256,
        List<String> containedIn,
        String parentUid,
        Context context)
        implements Distribution {

    public FileObject {
        containedIn = List.copyOf(containedIn);
    }

    @Override
    public NodeType type() {
        return NodeType.FILE_OBJECT;
    }

    @Override
    public void check(Issues issues) {
        Checks.mandatory(issues, context, Terms.NAME, name);
        Checks.mandatory(issues, context, Terms.CONTENT_URL, contentUrl);
        Checks.mandatory(issues, context, Terms.ENCODING_FORMAT, encodingFormat);
        // Files extracted from an archive are covered by the archive's own checksum.
        if (containedIn.isEmpty() && Checks.isMissing(md5) && Checks.isMissing(sha256)) {
            issues.error(context, "The node doesn't define any integrity property (like md5 or sha256).");
        }
        Checks.recommended(issues, context, Terms.DESCRIPTION, description);
    }
}
