package com.nayem.tether.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Fluent builder for a {@link Mutation}.
 *
 * <pre>
 * Mutation mutation = Mutation.editor()
 *         .setAttribute("color", "red")
 *         .addTags("loyalty", "vip")
 *         .build();
 * </pre>
 */
public class MutationEditor {

    private final Clock clock;
    private final List<MutationOperation> operations = new ArrayList<>();

    public MutationEditor(Clock clock) {
        this.clock = clock;
    }

    public MutationEditor setAttribute(String name, JsonNode value) {
        operations.add(new MutationOperation.SetAttribute(name, value, clock.instant()));
        return this;
    }

    public MutationEditor setAttribute(String name, String value) {
        return setAttribute(name, TextNode.valueOf(value));
    }

    public MutationEditor setAttribute(String name, long value) {
        return setAttribute(name, LongNode.valueOf(value));
    }

    public MutationEditor setAttribute(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("attribute '" + name + "' must be a finite number");
        }
        return setAttribute(name, DoubleNode.valueOf(value));
    }

    public MutationEditor setAttribute(String name, boolean value) {
        return setAttribute(name, BooleanNode.valueOf(value));
    }

    public MutationEditor removeAttribute(String name) {
        operations.add(new MutationOperation.RemoveAttribute(name, clock.instant()));
        return this;
    }

    public MutationEditor addTags(String group, String... tags) {
        return addTags(group, Arrays.asList(tags));
    }

    public MutationEditor addTags(String group, Collection<String> tags) {
        operations.add(new MutationOperation.AddTags(group, new LinkedHashSet<>(tags)));
        return this;
    }

    public MutationEditor removeTags(String group, String... tags) {
        return removeTags(group, Arrays.asList(tags));
    }

    public MutationEditor removeTags(String group, Collection<String> tags) {
        operations.add(new MutationOperation.RemoveTags(group, new LinkedHashSet<>(tags)));
        return this;
    }

    public MutationEditor setTags(String group, String... tags) {
        return setTags(group, Arrays.asList(tags));
    }

    public MutationEditor setTags(String group, Collection<String> tags) {
        operations.add(new MutationOperation.SetTags(group, new LinkedHashSet<>(tags)));
        return this;
    }

    public Mutation build() {
        return new Mutation(operations, clock.instant());
    }
}
