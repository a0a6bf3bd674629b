package com.nayem.tether.predicate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Leaf predicate: walks into the subject along {@code scope} and then the
 * dot-separated {@code key}, and applies a {@link JsonValueMatcher} to whatever
 * is found there.
 *
 * @param scope        object fields to descend into before the key, may be empty
 * @param key          dot-separated key path, or {@code null} to match the scoped value itself
 * @param valueMatcher matcher for the resolved value
 * @param ignoreCase   compare strings without regard to case
 */
public record JsonMatcher(List<String> scope, String key, JsonValueMatcher valueMatcher, boolean ignoreCase)
        implements JsonPredicate {

    public JsonMatcher {
        scope = scope == null ? List.of() : List.copyOf(scope);
        Objects.requireNonNull(valueMatcher, "valueMatcher");
        if (key != null && key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
    }

    public static JsonMatcher key(String key, JsonValueMatcher valueMatcher) {
        return new JsonMatcher(List.of(), key, valueMatcher, false);
    }

    public static JsonMatcher value(JsonValueMatcher valueMatcher) {
        return new JsonMatcher(List.of(), null, valueMatcher, false);
    }

    public JsonMatcher withScope(List<String> scope) {
        return new JsonMatcher(scope, key, valueMatcher, ignoreCase);
    }

    public JsonMatcher ignoringCase() {
        return new JsonMatcher(scope, key, valueMatcher, true);
    }

    /**
     * Scope segments followed by the key split on dots.
     */
    public List<String> path() {
        List<String> path = new ArrayList<>(scope);
        if (key != null) {
            for (String segment : key.split("\\.", -1)) {
                path.add(segment);
            }
        }
        return path;
    }

    @Override
    public Kind kind() {
        return Kind.MATCHER;
    }
}
