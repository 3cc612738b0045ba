package io.croissant.core.graph;

import com.fasterxml.jackson.databind.JsonNode;
import io.croissant.core.issues.Context;
import io.croissant.core.issues.Issues;
import io.croissant.core.model.Source;
import io.croissant.core.model.Terms;
import io.croissant.core.model.Transform;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Parses the {@code source} and {@code references} properties of a field.
 *
 * <p>
 * Two shapes are accepted: a bare reference string {@code #{node/column}}, or an object
 * {@code {"data": "#{node/column}", "applyTransform": {"regex": "..."}}} whose
 * {@code applyTransform} may also be an array. Problems are appended to the issue log and yield a
 * {@linkplain Source#malformed malformed} source.
 */
final class SourceParser {

    private static final Pattern REFERENCE = Pattern.compile("^#\\{([^#{}]+)}$");

    private SourceParser() {}

    static Source parse(JsonNode node, Issues issues, Context context) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Source.NONE;
        }
        if (node.isTextual()) {
            return parseReference(node.asText(), List.of(), issues, context);
        }
        if (node.isObject()) {
            JsonNode data = node.get(Terms.DATA);
            if (data == null || !data.isTextual()) {
                issues.error(context, "Malformed source data: " + node + ".");
                return Source.malformed(node.toString());
            }
            List<Transform> transforms = parseTransforms(node.get(Terms.APPLY_TRANSFORM), issues, context);
            return parseReference(data.asText(), transforms, issues, context);
        }
        issues.error(context, "Malformed source data: " + node + ".");
        return Source.malformed(node.toString());
    }

    private static Source parseReference(String raw, List<Transform> transforms, Issues issues, Context context) {
        Matcher matcher = REFERENCE.matcher(raw.trim());
        if (!matcher.matches()) {
            issues.error(context, "Malformed source data: " + raw + ".");
            return Source.malformed(raw);
        }
        List<String> path = Arrays.asList(matcher.group(1).split("/", -1));
        if (path.stream().anyMatch(String::isBlank)) {
            issues.error(context, "Malformed source data: " + raw + ".");
            return Source.malformed(raw);
        }
        return new Source(raw.trim(), path, transforms);
    }

    private static List<Transform> parseTransforms(JsonNode node, Issues issues, Context context) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        List<JsonNode> entries = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(entries::add);
        } else {
            entries.add(node);
        }
        List<Transform> transforms = new ArrayList<>();
        for (JsonNode entry : entries) {
            JsonNode regex = entry.get(Terms.REGEX);
            if (regex == null || !regex.isTextual()) {
                issues.error(context, "Unsupported transform " + entry + ": only \"" + Terms.iri(Terms.REGEX)
                        + "\" is supported.");
                continue;
            }
            try {
                transforms.add(Transform.regex(regex.asText()));
            } catch (PatternSyntaxException e) {
                issues.error(context, "Invalid regex \"" + regex.asText() + "\": " + e.getDescription() + ".");
            }
        }
        return transforms;
    }
}
