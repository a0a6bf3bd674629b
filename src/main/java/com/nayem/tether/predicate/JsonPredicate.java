package com.nayem.tether.predicate;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A boolean condition over a JSON value: either a logical combinator over child
 * predicates or a {@link JsonMatcher} leaf.
 * <p>
 * Predicates are immutable and safe to share between threads. Evaluation lives
 * in {@link PredicateEngine}.
 * </p>
 */
public sealed interface JsonPredicate permits JsonPredicate.And, JsonPredicate.Or, JsonPredicate.Not, JsonMatcher {

    enum Kind {
        AND,
        OR,
        NOT,
        MATCHER
    }

    Kind kind();

    static And and(JsonPredicate... children) {
        return new And(Arrays.asList(children));
    }

    static Or or(JsonPredicate... children) {
        return new Or(Arrays.asList(children));
    }

    static Not not(JsonPredicate child) {
        return new Not(child);
    }

    /**
     * True when every child is true. An empty list is true.
     */
    record And(List<JsonPredicate> children) implements JsonPredicate {
        public And {
            children = List.copyOf(children);
        }

        @Override
        public Kind kind() {
            return Kind.AND;
        }
    }

    /**
     * True when any child is true. An empty list is false.
     */
    record Or(List<JsonPredicate> children) implements JsonPredicate {
        public Or {
            children = List.copyOf(children);
        }

        @Override
        public Kind kind() {
            return Kind.OR;
        }
    }

    record Not(JsonPredicate child) implements JsonPredicate {
        public Not {
            Objects.requireNonNull(child, "child");
        }

        @Override
        public Kind kind() {
            return Kind.NOT;
        }
    }
}
