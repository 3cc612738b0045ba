package io.croissant.core.model;

import io.croissant.core.issues.Context;
import io.croissant.core.issues.Issues;
import java.util.List;

/**
 * The dataset root. Owns the distributions and record sets by uid.
 *
 * @param uid              the dataset name
 * @param name             dataset name
 * @param description      free-text description
 * @param license          license name or URL
 * @param url              landing page
 * @param citation         preferred citation
 * @param version          dataset version
 * @param creators         creator names
 * @param contributors     contributor names
 * @param distributionUids uids of the contained distributions, in document order
 * @param recordSetUids    uids of the contained record sets, in document order
 * @param context          breadcrumb
 */
public record Metadata(
        String uid,
        String name,
        String description,
        String license,
        String url,
        String citation,
        String version,
        List<String> creators,
        List<String> contributors,
        List<String> distributionUids,
        List<String> recordSetUids,
        Context context)
        implements Node {

    public Metadata {
        creators = List.copyOf(creators);
        contributors = List.copyOf(contributors);
        distributionUids = List.copyOf(distributionUids);
        recordSetUids = List.copyOf(recordSetUids);
    }

    @Override
    public NodeType type() {
        return NodeType.DATASET;
    }

    @Override
    public String parentUid() {
        return null;
    }

    @Override
    public void check(Issues issues) {
        Checks.mandatory(issues, context, Terms.NAME, name);
        Checks.recommended(issues, context, Terms.DESCRIPTION, description);
        Checks.recommended(issues, context, Terms.LICENSE, license);
        Checks.recommended(issues, context, Terms.URL, url);
    }
}
