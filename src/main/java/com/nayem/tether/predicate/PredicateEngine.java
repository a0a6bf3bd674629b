package com.nayem.tether.predicate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates {@link JsonPredicate}s against JSON values.
 * <p>
 * Evaluation is pure and total: it never throws and holds no mutable state
 * beyond a cache of parsed predicate documents, so one engine can be shared by
 * any number of threads. Anything that cannot be compared (wrong type, malformed
 * version, unparseable predicate) evaluates to {@code false}.
 * </p>
 */
public class PredicateEngine {

    private static final Logger log = LoggerFactory.getLogger(PredicateEngine.class);

    private final Cache<String, Optional<JsonPredicate>> parsed;

    public PredicateEngine() {
        this(512);
    }

    /**
     * @param maxCachedPredicates how many parsed predicate documents to keep
     */
    public PredicateEngine(long maxCachedPredicates) {
        this.parsed = Caffeine.newBuilder()
                .maximumSize(maxCachedPredicates)
                .build();
    }

    /**
     * Parses {@code predicateJson} (cached) and evaluates it. A malformed
     * predicate never matches.
     */
    public boolean evaluate(JsonNode predicateJson, JsonNode subject) {
        if (predicateJson == null) {
            return false;
        }
        Optional<JsonPredicate> predicate = parsed.get(predicateJson.toString(), text -> {
            try {
                return Optional.of(JsonPredicateParser.parse(predicateJson));
            } catch (JsonPredicateException e) {
                log.debug("Malformed predicate evaluates to no match: {}", e.getMessage());
                return Optional.empty();
            }
        });
        return predicate.map(p -> matches(p, subject)).orElse(false);
    }

    public boolean matches(JsonPredicate predicate, JsonNode subject) {
        if (predicate == null) {
            return false;
        }
        JsonNode value = subject == null ? MissingNode.getInstance() : subject;
        try {
            return evaluatePredicate(predicate, value);
        } catch (RuntimeException e) {
            log.debug("Predicate evaluation failed closed", e);
            return false;
        }
    }

    private boolean evaluatePredicate(JsonPredicate predicate, JsonNode subject) {
        return switch (predicate.kind()) {
            case AND -> {
                for (JsonPredicate child : ((JsonPredicate.And) predicate).children()) {
                    if (!evaluatePredicate(child, subject)) {
                        yield false;
                    }
                }
                yield true;
            }
            case OR -> {
                for (JsonPredicate child : ((JsonPredicate.Or) predicate).children()) {
                    if (evaluatePredicate(child, subject)) {
                        yield true;
                    }
                }
                yield false;
            }
            case NOT -> !evaluatePredicate(((JsonPredicate.Not) predicate).child(), subject);
            case MATCHER -> evaluateMatcher((JsonMatcher) predicate, subject);
        };
    }

    private boolean evaluateMatcher(JsonMatcher matcher, JsonNode subject) {
        JsonNode value = resolve(subject, matcher.path());
        return evaluateValue(matcher.valueMatcher(), value, matcher.ignoreCase());
    }

    private static JsonNode resolve(JsonNode subject, List<String> path) {
        JsonNode current = subject;
        for (String segment : path) {
            if (current == null || !current.isObject()) {
                return MissingNode.getInstance();
            }
            current = current.get(segment);
        }
        return current == null ? MissingNode.getInstance() : current;
    }

    private static boolean isAbsent(JsonNode value) {
        return value == null || value.isMissingNode() || value.isNull();
    }

    private boolean evaluateValue(JsonValueMatcher matcher, JsonNode value, boolean ignoreCase) {
        return switch (matcher.kind()) {
            case PRESENCE -> ((JsonValueMatcher.Presence) matcher).present() != isAbsent(value);
            case EQUALS -> !isAbsent(value)
                    && jsonEquals(((JsonValueMatcher.Equals) matcher).value(), value, ignoreCase);
            case NUMBER_RANGE -> {
                if (isAbsent(value) || !value.isNumber()) {
                    yield false;
                }
                JsonValueMatcher.NumberRange range = (JsonValueMatcher.NumberRange) matcher;
                BigDecimal number = value.decimalValue();
                yield (range.atLeast() == null || number.compareTo(range.atLeast()) >= 0)
                        && (range.atMost() == null || number.compareTo(range.atMost()) <= 0);
            }
            case VERSION -> !isAbsent(value) && value.isTextual()
                    && ((JsonValueMatcher.VersionMatches) matcher).constraint().matches(value.textValue());
            case ARRAY_CONTAINS -> {
                if (isAbsent(value) || !value.isArray()) {
                    yield false;
                }
                JsonValueMatcher.ArrayContains contains = (JsonValueMatcher.ArrayContains) matcher;
                if (contains.index() != null) {
                    int index = contains.index();
                    yield index >= 0 && index < value.size()
                            && evaluatePredicate(contains.predicate(), value.get(index));
                }
                boolean found = false;
                for (JsonNode element : value) {
                    if (evaluatePredicate(contains.predicate(), element)) {
                        found = true;
                        break;
                    }
                }
                yield found;
            }
        };
    }

    static boolean jsonEquals(JsonNode expected, JsonNode actual, boolean ignoreCase) {
        if (expected.isNumber() && actual.isNumber()) {
            return expected.decimalValue().compareTo(actual.decimalValue()) == 0;
        }
        if (expected.isTextual() && actual.isTextual()) {
            return ignoreCase
                    ? expected.textValue().equalsIgnoreCase(actual.textValue())
                    : expected.textValue().equals(actual.textValue());
        }
        if (expected.isBoolean() && actual.isBoolean()) {
            return expected.booleanValue() == actual.booleanValue();
        }
        if (expected.isNull() && actual.isNull()) {
            return true;
        }
        if (expected.isArray() && actual.isArray()) {
            if (expected.size() != actual.size()) {
                return false;
            }
            for (int i = 0; i < expected.size(); i++) {
                if (!jsonEquals(expected.get(i), actual.get(i), ignoreCase)) {
                    return false;
                }
            }
            return true;
        }
        if (expected.isObject() && actual.isObject()) {
            if (expected.size() != actual.size()) {
                return false;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = expected.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode other = actual.get(field.getKey());
                if (other == null || !jsonEquals(field.getValue(), other, ignoreCase)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }
}
