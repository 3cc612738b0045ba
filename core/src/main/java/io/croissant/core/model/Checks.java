package io.croissant.core.model;

import io.croissant.core.issues.Context;
import io.croissant.core.issues.Issues;
import java.util.Collection;

/** Property presence checks shared by the node {@code check} implementations. */
final class Checks {

    private Checks() {}

    static void mandatory(Issues issues, Context context, String property, Object value) {
        if (isMissing(value)) {
            issues.error(context, "Property \"" + Terms.iri(property) + "\" is mandatory, but does not exist.");
        }
    }

    static void recommended(Issues issues, Context context, String property, Object value) {
        if (isMissing(value)) {
            issues.warning(context, "Property \"" + Terms.iri(property) + "\" is recommended, but does not exist.");
        }
    }

    static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String text) {
            return text.isBlank();
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        return false;
    }
}
