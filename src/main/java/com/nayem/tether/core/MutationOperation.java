package com.nayem.tether.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A single typed edit against a named attribute or a tag group.
 * <p>
 * The set of operation kinds is closed. Code that handles operations switches
 * over {@link #kind()} so that a new kind breaks compilation at every site that
 * has to learn about it.
 * </p>
 */
public sealed interface MutationOperation
        permits MutationOperation.SetAttribute, MutationOperation.RemoveAttribute,
        MutationOperation.AddTags, MutationOperation.RemoveTags, MutationOperation.SetTags {

    enum Kind {
        SET_ATTRIBUTE(Namespace.ATTRIBUTE, "set"),
        REMOVE_ATTRIBUTE(Namespace.ATTRIBUTE, "remove"),
        ADD_TAGS(Namespace.TAG_GROUP, "add"),
        REMOVE_TAGS(Namespace.TAG_GROUP, "remove"),
        SET_TAGS(Namespace.TAG_GROUP, "set");

        private final Namespace namespace;
        private final String action;

        Kind(Namespace namespace, String action) {
            this.namespace = namespace;
            this.action = action;
        }

        public Namespace namespace() {
            return namespace;
        }

        /**
         * Wire name of the action inside its namespace.
         */
        public String action() {
            return action;
        }
    }

    /**
     * Attributes and tag groups collapse independently of each other.
     */
    enum Namespace {
        ATTRIBUTE,
        TAG_GROUP
    }

    Kind kind();

    /**
     * The attribute name or tag group this operation targets.
     */
    String target();

    record SetAttribute(String name, JsonNode value, Instant timestamp) implements MutationOperation {
        public SetAttribute {
            name = requireName(name, "attribute name");
            value = value == null ? NullNode.getInstance() : value.deepCopy();
            Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Kind kind() {
            return Kind.SET_ATTRIBUTE;
        }

        @Override
        public String target() {
            return name;
        }
    }

    record RemoveAttribute(String name, Instant timestamp) implements MutationOperation {
        public RemoveAttribute {
            name = requireName(name, "attribute name");
            Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Kind kind() {
            return Kind.REMOVE_ATTRIBUTE;
        }

        @Override
        public String target() {
            return name;
        }
    }

    record AddTags(String group, Set<String> tags) implements MutationOperation {
        public AddTags {
            group = requireName(group, "tag group");
            tags = requireTags(tags, false);
        }

        @Override
        public Kind kind() {
            return Kind.ADD_TAGS;
        }

        @Override
        public String target() {
            return group;
        }
    }

    record RemoveTags(String group, Set<String> tags) implements MutationOperation {
        public RemoveTags {
            group = requireName(group, "tag group");
            tags = requireTags(tags, false);
        }

        @Override
        public Kind kind() {
            return Kind.REMOVE_TAGS;
        }

        @Override
        public String target() {
            return group;
        }
    }

    /**
     * Replaces every tag in the group. An empty set clears the group.
     */
    record SetTags(String group, Set<String> tags) implements MutationOperation {
        public SetTags {
            group = requireName(group, "tag group");
            tags = requireTags(tags, true);
        }

        @Override
        public Kind kind() {
            return Kind.SET_TAGS;
        }

        @Override
        public String target() {
            return group;
        }
    }

    private static String requireName(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
        return value.trim();
    }

    private static Set<String> requireTags(Collection<String> tags, boolean allowEmpty) {
        if (tags == null) {
            throw new IllegalArgumentException("tags must not be null");
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String tag : tags) {
            normalized.add(requireName(tag, "tag"));
        }
        if (normalized.isEmpty() && !allowEmpty) {
            throw new IllegalArgumentException("at least one tag is required");
        }
        return Collections.unmodifiableSet(normalized);
    }
}
