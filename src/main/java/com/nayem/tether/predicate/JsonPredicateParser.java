package com.nayem.tether.predicate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the JSON form of {@link JsonPredicate}s.
 *
 * <pre>
 * {"and": [
 *     {"key": "status", "value": {"equals": "active"}},
 *     {"key": "score",  "value": {"at_least": 10}}
 * ]}
 * </pre>
 *
 * Matchers accept {@code key} (dot-separated path), {@code scope} (string or
 * array of strings) and {@code ignore_case}. Value matchers are
 * {@code equals}, {@code at_least}/{@code at_most}, {@code is_present},
 * {@code version_matches} (or {@code version}) and {@code array_contains} with
 * an optional {@code index}.
 */
public final class JsonPredicateParser {

    static final String AND = "and";
    static final String OR = "or";
    static final String NOT = "not";
    static final String KEY = "key";
    static final String SCOPE = "scope";
    static final String VALUE = "value";
    static final String IGNORE_CASE = "ignore_case";
    static final String EQUALS = "equals";
    static final String AT_LEAST = "at_least";
    static final String AT_MOST = "at_most";
    static final String IS_PRESENT = "is_present";
    static final String VERSION_MATCHES = "version_matches";
    static final String VERSION = "version";
    static final String ARRAY_CONTAINS = "array_contains";
    static final String INDEX = "index";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonPredicateParser() {
    }

    public static JsonPredicate parse(String json) {
        if (json == null) {
            throw new JsonPredicateException("predicate JSON must not be null");
        }
        try {
            return parse(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new JsonPredicateException("predicate is not valid JSON", e);
        }
    }

    public static JsonPredicate parse(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new JsonPredicateException("predicate must be a JSON object: " + json);
        }
        if (json.has(AND)) {
            return new JsonPredicate.And(children(json.get(AND), AND));
        }
        if (json.has(OR)) {
            return new JsonPredicate.Or(children(json.get(OR), OR));
        }
        if (json.has(NOT)) {
            JsonNode not = json.get(NOT);
            if (not.isArray()) {
                if (not.size() != 1) {
                    throw new JsonPredicateException("'not' takes exactly one predicate, got " + not.size());
                }
                return new JsonPredicate.Not(parse(not.get(0)));
            }
            return new JsonPredicate.Not(parse(not));
        }
        return parseMatcher(json);
    }

    private static List<JsonPredicate> children(JsonNode node, String operator) {
        if (!node.isArray()) {
            throw new JsonPredicateException("'" + operator + "' must hold an array of predicates");
        }
        List<JsonPredicate> children = new ArrayList<>(node.size());
        for (JsonNode child : node) {
            children.add(parse(child));
        }
        return children;
    }

    private static JsonMatcher parseMatcher(JsonNode json) {
        List<String> scope = new ArrayList<>();
        JsonNode scopeNode = json.get(SCOPE);
        if (scopeNode != null && !scopeNode.isNull()) {
            if (scopeNode.isTextual()) {
                scope.add(scopeNode.textValue());
            } else if (scopeNode.isArray()) {
                for (JsonNode segment : scopeNode) {
                    if (!segment.isTextual()) {
                        throw new JsonPredicateException("scope entries must be strings: " + scopeNode);
                    }
                    scope.add(segment.textValue());
                }
            } else {
                throw new JsonPredicateException("scope must be a string or an array of strings: " + scopeNode);
            }
        }

        String key = null;
        JsonNode keyNode = json.get(KEY);
        if (keyNode != null && !keyNode.isNull()) {
            if (!keyNode.isTextual() || keyNode.textValue().isEmpty()) {
                throw new JsonPredicateException("key must be a non-empty string: " + keyNode);
            }
            key = keyNode.textValue();
        }

        boolean ignoreCase = false;
        JsonNode ignoreCaseNode = json.get(IGNORE_CASE);
        if (ignoreCaseNode != null && !ignoreCaseNode.isNull()) {
            if (!ignoreCaseNode.isBoolean()) {
                throw new JsonPredicateException("ignore_case must be a boolean: " + ignoreCaseNode);
            }
            ignoreCase = ignoreCaseNode.booleanValue();
        }

        JsonNode valueNode = json.get(VALUE);
        if (valueNode == null) {
            throw new JsonPredicateException("matcher is missing 'value': " + json);
        }
        return new JsonMatcher(scope, key, parseValueMatcher(valueNode), ignoreCase);
    }

    static JsonValueMatcher parseValueMatcher(JsonNode json) {
        if (!json.isObject()) {
            throw new JsonPredicateException("value matcher must be a JSON object: " + json);
        }
        if (json.has(EQUALS)) {
            return new JsonValueMatcher.Equals(json.get(EQUALS));
        }
        if (json.has(AT_LEAST) || json.has(AT_MOST)) {
            JsonNode min = json.get(AT_LEAST);
            JsonNode max = json.get(AT_MOST);
            if ((min != null && !min.isNumber()) || (max != null && !max.isNumber())) {
                throw new JsonPredicateException("range bounds must be numbers: " + json);
            }
            try {
                return new JsonValueMatcher.NumberRange(
                        min == null ? null : min.decimalValue(),
                        max == null ? null : max.decimalValue());
            } catch (IllegalArgumentException e) {
                throw new JsonPredicateException(e.getMessage(), e);
            }
        }
        if (json.has(IS_PRESENT)) {
            JsonNode present = json.get(IS_PRESENT);
            if (!present.isBoolean()) {
                throw new JsonPredicateException("is_present must be a boolean: " + present);
            }
            return new JsonValueMatcher.Presence(present.booleanValue());
        }
        if (json.has(VERSION_MATCHES) || json.has(VERSION)) {
            JsonNode constraint = json.has(VERSION_MATCHES) ? json.get(VERSION_MATCHES) : json.get(VERSION);
            if (!constraint.isTextual()) {
                throw new JsonPredicateException("version constraint must be a string: " + constraint);
            }
            try {
                return new JsonValueMatcher.VersionMatches(VersionConstraint.parse(constraint.textValue()));
            } catch (IllegalArgumentException e) {
                throw new JsonPredicateException(e.getMessage(), e);
            }
        }
        if (json.has(ARRAY_CONTAINS)) {
            JsonPredicate predicate = parse(json.get(ARRAY_CONTAINS));
            JsonNode index = json.get(INDEX);
            if (index == null || index.isNull()) {
                return new JsonValueMatcher.ArrayContains(predicate, null);
            }
            if (!index.canConvertToInt() || !index.isIntegralNumber()) {
                throw new JsonPredicateException("index must be an integer: " + index);
            }
            return new JsonValueMatcher.ArrayContains(predicate, index.intValue());
        }
        throw new JsonPredicateException("unknown value matcher: " + json);
    }

    public static ObjectNode toJson(JsonPredicate predicate) {
        return switch (predicate.kind()) {
            case AND -> combinator(AND, ((JsonPredicate.And) predicate).children());
            case OR -> combinator(OR, ((JsonPredicate.Or) predicate).children());
            case NOT -> {
                ObjectNode node = NODES.objectNode();
                node.putArray(NOT).add(toJson(((JsonPredicate.Not) predicate).child()));
                yield node;
            }
            case MATCHER -> matcherJson((JsonMatcher) predicate);
        };
    }

    private static ObjectNode combinator(String name, List<JsonPredicate> children) {
        ObjectNode node = NODES.objectNode();
        ArrayNode array = node.putArray(name);
        children.forEach(child -> array.add(toJson(child)));
        return node;
    }

    private static ObjectNode matcherJson(JsonMatcher matcher) {
        ObjectNode node = NODES.objectNode();
        if (!matcher.scope().isEmpty()) {
            ArrayNode scope = node.putArray(SCOPE);
            matcher.scope().forEach(scope::add);
        }
        if (matcher.key() != null) {
            node.put(KEY, matcher.key());
        }
        if (matcher.ignoreCase()) {
            node.put(IGNORE_CASE, true);
        }
        node.set(VALUE, valueMatcherJson(matcher.valueMatcher()));
        return node;
    }

    static ObjectNode valueMatcherJson(JsonValueMatcher matcher) {
        ObjectNode node = NODES.objectNode();
        switch (matcher.kind()) {
            case EQUALS -> node.set(EQUALS, ((JsonValueMatcher.Equals) matcher).value().deepCopy());
            case NUMBER_RANGE -> {
                JsonValueMatcher.NumberRange range = (JsonValueMatcher.NumberRange) matcher;
                if (range.atLeast() != null) {
                    node.put(AT_LEAST, range.atLeast());
                }
                if (range.atMost() != null) {
                    node.put(AT_MOST, range.atMost());
                }
            }
            case PRESENCE -> node.put(IS_PRESENT, ((JsonValueMatcher.Presence) matcher).present());
            case VERSION -> node.put(VERSION_MATCHES,
                    ((JsonValueMatcher.VersionMatches) matcher).constraint().expression());
            case ARRAY_CONTAINS -> {
                JsonValueMatcher.ArrayContains contains = (JsonValueMatcher.ArrayContains) matcher;
                node.set(ARRAY_CONTAINS, toJson(contains.predicate()));
                if (contains.index() != null) {
                    node.put(INDEX, contains.index());
                }
            }
        }
        return node;
    }
}
