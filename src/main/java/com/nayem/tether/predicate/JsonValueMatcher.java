package com.nayem.tether.predicate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Matches a single (possibly absent) JSON value.
 */
public sealed interface JsonValueMatcher
        permits JsonValueMatcher.Equals, JsonValueMatcher.NumberRange, JsonValueMatcher.Presence,
        JsonValueMatcher.VersionMatches, JsonValueMatcher.ArrayContains {

    enum Kind {
        EQUALS,
        NUMBER_RANGE,
        PRESENCE,
        VERSION,
        ARRAY_CONTAINS
    }

    Kind kind();

    static Equals equalTo(JsonNode value) {
        return new Equals(value);
    }

    static Equals equalTo(String value) {
        return new Equals(TextNode.valueOf(value));
    }

    static Equals equalTo(boolean value) {
        return new Equals(BooleanNode.valueOf(value));
    }

    static Equals equalTo(Number value) {
        return new Equals(DecimalNode.valueOf(new BigDecimal(value.toString())));
    }

    static NumberRange atLeast(Number min) {
        return new NumberRange(decimal(min), null);
    }

    static NumberRange atMost(Number max) {
        return new NumberRange(null, decimal(max));
    }

    static NumberRange inRange(Number min, Number max) {
        return new NumberRange(decimal(min), decimal(max));
    }

    static Presence present() {
        return new Presence(true);
    }

    static Presence absent() {
        return new Presence(false);
    }

    /**
     * @throws IllegalArgumentException if the constraint cannot be parsed
     */
    static VersionMatches versionMatches(String constraint) {
        return new VersionMatches(VersionConstraint.parse(constraint));
    }

    static ArrayContains arrayContains(JsonPredicate predicate) {
        return new ArrayContains(predicate, null);
    }

    static ArrayContains arrayContains(JsonPredicate predicate, int index) {
        return new ArrayContains(predicate, index);
    }

    private static BigDecimal decimal(Number number) {
        return number == null ? null : new BigDecimal(number.toString());
    }

    /**
     * Type-strict structural equality. Numbers compare by value.
     */
    record Equals(JsonNode value) implements JsonValueMatcher {
        public Equals {
            value = value == null ? NullNode.getInstance() : value.deepCopy();
        }

        @Override
        public Kind kind() {
            return Kind.EQUALS;
        }
    }

    /**
     * Inclusive numeric bounds; either bound may be open.
     */
    record NumberRange(BigDecimal atLeast, BigDecimal atMost) implements JsonValueMatcher {
        public NumberRange {
            if (atLeast == null && atMost == null) {
                throw new IllegalArgumentException("a number range needs at least one bound");
            }
        }

        @Override
        public Kind kind() {
            return Kind.NUMBER_RANGE;
        }
    }

    record Presence(boolean present) implements JsonValueMatcher {
        @Override
        public Kind kind() {
            return Kind.PRESENCE;
        }
    }

    record VersionMatches(VersionConstraint constraint) implements JsonValueMatcher {
        public VersionMatches {
            Objects.requireNonNull(constraint, "constraint");
        }

        @Override
        public Kind kind() {
            return Kind.VERSION;
        }
    }

    /**
     * Matches an array with at least one element satisfying {@code predicate}, or
     * only the element at {@code index} when one is given.
     */
    record ArrayContains(JsonPredicate predicate, Integer index) implements JsonValueMatcher {
        public ArrayContains {
            Objects.requireNonNull(predicate, "predicate");
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY_CONTAINS;
        }
    }
}
