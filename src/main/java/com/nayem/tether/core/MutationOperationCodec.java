package com.nayem.tether.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * JSON form of an operation list, shared by the persisted rows and the request
 * body sent to the backend.
 *
 * <pre>
 * [{"action": "set", "attribute": "color", "value": "red", "timestamp": "2024-01-01T00:00:00Z"},
 *  {"action": "add", "group": "loyalty", "tags": ["vip"]}]
 * </pre>
 */
public class MutationOperationCodec {

    private static final String ACTION = "action";
    private static final String ATTRIBUTE = "attribute";
    private static final String VALUE = "value";
    private static final String TIMESTAMP = "timestamp";
    private static final String GROUP = "group";
    private static final String TAGS = "tags";

    private final ObjectMapper objectMapper;

    public MutationOperationCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ArrayNode toJson(List<MutationOperation> operations) {
        ArrayNode array = objectMapper.createArrayNode();
        for (MutationOperation operation : operations) {
            array.add(toJson(operation));
        }
        return array;
    }

    public ObjectNode toJson(MutationOperation operation) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(ACTION, operation.kind().action());
        switch (operation.kind()) {
            case SET_ATTRIBUTE -> {
                MutationOperation.SetAttribute set = (MutationOperation.SetAttribute) operation;
                node.put(ATTRIBUTE, set.name());
                node.set(VALUE, set.value().deepCopy());
                node.put(TIMESTAMP, set.timestamp().toString());
            }
            case REMOVE_ATTRIBUTE -> {
                MutationOperation.RemoveAttribute remove = (MutationOperation.RemoveAttribute) operation;
                node.put(ATTRIBUTE, remove.name());
                node.put(TIMESTAMP, remove.timestamp().toString());
            }
            case ADD_TAGS -> tags(node, operation.target(), ((MutationOperation.AddTags) operation).tags());
            case REMOVE_TAGS -> tags(node, operation.target(), ((MutationOperation.RemoveTags) operation).tags());
            case SET_TAGS -> tags(node, operation.target(), ((MutationOperation.SetTags) operation).tags());
        }
        return node;
    }

    private static void tags(ObjectNode node, String group, Set<String> tags) {
        node.put(GROUP, group);
        ArrayNode array = node.putArray(TAGS);
        tags.forEach(array::add);
    }

    public String write(List<MutationOperation> operations) {
        try {
            return objectMapper.writeValueAsString(toJson(operations));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize mutation operations", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the JSON does not describe an operation list
     */
    public List<MutationOperation> read(String json) {
        try {
            return fromJson(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Stored operations are not valid JSON", e);
        }
    }

    public List<MutationOperation> fromJson(JsonNode json) {
        if (json == null || !json.isArray()) {
            throw new IllegalArgumentException("operations must be a JSON array");
        }
        List<MutationOperation> operations = new ArrayList<>(json.size());
        for (JsonNode node : json) {
            operations.add(operationFromJson(node));
        }
        return operations;
    }

    private MutationOperation operationFromJson(JsonNode node) {
        String action = text(node, ACTION);
        if (node.has(ATTRIBUTE)) {
            String name = text(node, ATTRIBUTE);
            Instant timestamp = timestamp(node);
            return switch (action) {
                case "set" -> new MutationOperation.SetAttribute(name, node.get(VALUE), timestamp);
                case "remove" -> new MutationOperation.RemoveAttribute(name, timestamp);
                default -> throw new IllegalArgumentException("unknown attribute action: " + action);
            };
        }
        if (node.has(GROUP)) {
            String group = text(node, GROUP);
            JsonNode tagsNode = node.get(TAGS);
            if (tagsNode == null || !tagsNode.isArray()) {
                throw new IllegalArgumentException("tag operation without a tags array: " + node);
            }
            Set<String> tags = new LinkedHashSet<>();
            tagsNode.forEach(tag -> tags.add(tag.asText()));
            return switch (action) {
                case "add" -> new MutationOperation.AddTags(group, tags);
                case "remove" -> new MutationOperation.RemoveTags(group, tags);
                case "set" -> new MutationOperation.SetTags(group, tags);
                default -> throw new IllegalArgumentException("unknown tag action: " + action);
            };
        }
        throw new IllegalArgumentException("operation targets neither an attribute nor a tag group: " + node);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException("missing '" + field + "' in " + node);
        }
        return value.textValue();
    }

    private static Instant timestamp(JsonNode node) {
        JsonNode value = node.get(TIMESTAMP);
        if (value == null || value.isNull()) {
            return Instant.EPOCH;
        }
        try {
            return Instant.parse(value.asText());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid timestamp in " + node, e);
        }
    }
}
