package io.croissant.core.model;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex extraction applied to a source value: the pattern is matched at the start of the value
 * and the first capture group that participated in the match replaces the value. A value the
 * pattern does not match, or a pattern without capture groups, leaves the value unchanged.
 *
 * @param regex the compiled extraction pattern
 */
public record Transform(Pattern regex) {

    public Transform {
        Objects.requireNonNull(regex, "regex must not be null");
    }

    public static Transform regex(String pattern) {
        return new Transform(Pattern.compile(pattern));
    }

    public String apply(String value) {
        if (value == null) {
            return null;
        }
        Matcher matcher = regex.matcher(value);
        if (!matcher.lookingAt()) {
            return value;
        }
        for (int group = 1; group <= matcher.groupCount(); group++) {
            String captured = matcher.group(group);
            if (captured != null) {
                return captured;
            }
        }
        return value;
    }
}
