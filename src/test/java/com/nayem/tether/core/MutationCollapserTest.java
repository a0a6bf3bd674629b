package com.nayem.tether.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.nayem.tether.core.MutationCollapser.Mode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class MutationCollapserTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final List<String> ATTRIBUTES = List.of("color", "size");
    private static final List<String> GROUPS = List.of("loyalty", "interests");
    private static final List<String> TAGS = List.of("a", "b", "c");

    private static MutationOperation set(String name, String value) {
        return new MutationOperation.SetAttribute(name, TextNode.valueOf(value), T0);
    }

    private static MutationOperation remove(String name) {
        return new MutationOperation.RemoveAttribute(name, T0);
    }

    private static MutationOperation add(String group, String... tags) {
        return new MutationOperation.AddTags(group, Set.of(tags));
    }

    private static MutationOperation removeTags(String group, String... tags) {
        return new MutationOperation.RemoveTags(group, Set.of(tags));
    }

    private static MutationOperation setTags(String group, String... tags) {
        return new MutationOperation.SetTags(group, Set.of(tags));
    }

    @Test
    void laterAttributeSetWins() {
        List<MutationOperation> collapsed = MutationCollapser.collapse(
                List.of(set("color", "red"), set("color", "blue")), Mode.ANNIHILATE);

        assertEquals(List.of(set("color", "blue")), collapsed);
    }

    @Test
    void removeAfterSetLeavesRemove() {
        List<MutationOperation> collapsed = MutationCollapser.collapse(
                List.of(set("color", "red"), remove("color")), Mode.ANNIHILATE);

        assertEquals(List.of(remove("color")), collapsed);
    }

    @Test
    void addThenRemoveCancelsWhileUnsent() {
        List<MutationOperation> collapsed = MutationCollapser.collapse(
                List.of(add("loyalty", "vip"), removeTags("loyalty", "vip")), Mode.ANNIHILATE);

        assertTrue(collapsed.isEmpty());
    }

    @Test
    void addThenRemoveKeepsRemoveOnceSent() {
        List<MutationOperation> collapsed = MutationCollapser.collapse(
                List.of(add("loyalty", "vip"), removeTags("loyalty", "vip")), Mode.NET_EFFECT);

        assertEquals(List.of(removeTags("loyalty", "vip")), collapsed);
    }

    @Test
    void setTagsAbsorbsEarlierAndLaterEdits() {
        List<MutationOperation> collapsed = MutationCollapser.collapse(List.of(
                add("loyalty", "gold"),
                setTags("loyalty", "silver", "bronze"),
                add("loyalty", "vip"),
                removeTags("loyalty", "bronze")), Mode.ANNIHILATE);

        assertEquals(List.of(setTags("loyalty", "silver", "vip")), collapsed);
    }

    @Test
    void emptySetTagsClearsGroup() {
        List<MutationOperation> collapsed = MutationCollapser.collapse(
                List.of(add("loyalty", "gold"), setTags("loyalty")), Mode.ANNIHILATE);

        assertEquals(List.of(setTags("loyalty")), collapsed);
    }

    @Test
    void attributesAndTagGroupsWithSameNameAreIndependent() {
        List<MutationOperation> collapsed = MutationCollapser.collapse(
                List.of(set("vip", "yes"), add("vip", "x"), remove("vip")), Mode.ANNIHILATE);

        assertEquals(List.of(add("vip", "x"), remove("vip")), collapsed);
    }

    @Test
    void outputFollowsLastTouchOrder() {
        List<MutationOperation> collapsed = MutationCollapser.collapse(List.of(
                set("color", "red"),
                set("size", "m"),
                add("loyalty", "vip"),
                set("color", "blue")), Mode.ANNIHILATE);

        assertEquals(List.of(set("size", "m"), add("loyalty", "vip"), set("color", "blue")), collapsed);
    }

    @Test
    void pendingAndAppendedAreFoldedTogether() {
        List<MutationOperation> collapsed = MutationCollapser.collapse(
                List.of(add("loyalty", "vip", "gold")),
                List.of(removeTags("loyalty", "gold"), set("color", "red")),
                Mode.ANNIHILATE);

        assertEquals(List.of(add("loyalty", "vip"), set("color", "red")), collapsed);
    }

    @Test
    void collapseIsIdempotent() {
        Random random = new Random(7);
        for (int run = 0; run < 200; run++) {
            List<MutationOperation> operations = randomOperations(random);
            for (Mode mode : Mode.values()) {
                List<MutationOperation> once = MutationCollapser.collapse(operations, mode);
                assertEquals(once, MutationCollapser.collapse(once, mode));
            }
        }
    }

    @Test
    void netEffectPreservesEndStateFromAnyStart() {
        Random random = new Random(11);
        for (int run = 0; run < 500; run++) {
            List<MutationOperation> operations = randomOperations(random);
            AudienceState base = AudienceState.random(random);

            AudienceState expected = base.copy().applyAll(operations);
            AudienceState actual = base.copy().applyAll(MutationCollapser.collapse(operations, Mode.NET_EFFECT));

            assertEquals(expected, actual, () -> "operations " + operations);
        }
    }

    @Test
    void annihilatePreservesEndStateWhenEditsReflectRealChanges() {
        Random random = new Random(13);
        for (int run = 0; run < 500; run++) {
            AudienceState base = AudienceState.random(random);
            List<MutationOperation> operations = base.realChanges(random);

            AudienceState expected = base.copy().applyAll(operations);
            AudienceState actual = base.copy().applyAll(MutationCollapser.collapse(operations, Mode.ANNIHILATE));

            assertEquals(expected, actual, () -> "operations " + operations + " from " + base);
        }
    }

    @Test
    void eachTargetAppearsOnceInCollapsedAttributes() {
        Random random = new Random(17);
        for (int run = 0; run < 200; run++) {
            List<MutationOperation> collapsed =
                    MutationCollapser.collapse(randomOperations(random), Mode.NET_EFFECT);
            Set<String> seen = new HashSet<>();
            for (MutationOperation operation : collapsed) {
                if (operation.kind().namespace() == MutationOperation.Namespace.ATTRIBUTE) {
                    assertTrue(seen.add(operation.target()), () -> "duplicate attribute in " + collapsed);
                }
            }
        }
    }

    private static List<MutationOperation> randomOperations(Random random) {
        int count = 1 + random.nextInt(12);
        List<MutationOperation> operations = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String attribute = ATTRIBUTES.get(random.nextInt(ATTRIBUTES.size()));
            String group = GROUPS.get(random.nextInt(GROUPS.size()));
            switch (random.nextInt(5)) {
                case 0 -> operations.add(set(attribute, "v" + random.nextInt(3)));
                case 1 -> operations.add(remove(attribute));
                case 2 -> operations.add(new MutationOperation.AddTags(group, randomTags(random, false)));
                case 3 -> operations.add(new MutationOperation.RemoveTags(group, randomTags(random, false)));
                default -> operations.add(new MutationOperation.SetTags(group, randomTags(random, true)));
            }
        }
        return operations;
    }

    private static Set<String> randomTags(Random random, boolean allowEmpty) {
        Set<String> tags = new LinkedHashSet<>();
        for (String tag : TAGS) {
            if (random.nextBoolean()) {
                tags.add(tag);
            }
        }
        if (tags.isEmpty() && !allowEmpty) {
            tags.add(TAGS.get(random.nextInt(TAGS.size())));
        }
        return tags;
    }

    /**
     * Remote view of one audience member, used to compare end states.
     */
    private static final class AudienceState {
        private final Map<String, JsonNode> attributes = new HashMap<>();
        private final Map<String, Set<String>> tags = new HashMap<>();

        static AudienceState random(Random random) {
            AudienceState state = new AudienceState();
            for (String attribute : ATTRIBUTES) {
                if (random.nextBoolean()) {
                    state.attributes.put(attribute, IntNode.valueOf(random.nextInt(100)));
                }
            }
            for (String group : GROUPS) {
                state.tags.put(group, randomTags(random, true));
            }
            return state;
        }

        AudienceState copy() {
            AudienceState copy = new AudienceState();
            copy.attributes.putAll(attributes);
            tags.forEach((group, members) -> copy.tags.put(group, new HashSet<>(members)));
            return copy;
        }

        /**
         * Random operations where every tag add or remove changes the state it
         * is applied to.
         */
        List<MutationOperation> realChanges(Random random) {
            AudienceState running = copy();
            List<MutationOperation> operations = new ArrayList<>();
            for (MutationOperation candidate : randomOperations(random)) {
                MutationOperation operation = candidate;
                if (candidate.kind() == MutationOperation.Kind.ADD_TAGS
                        || candidate.kind() == MutationOperation.Kind.REMOVE_TAGS) {
                    boolean adding = candidate.kind() == MutationOperation.Kind.ADD_TAGS;
                    Set<String> members = running.group(candidate.target());
                    Set<String> changing = new LinkedHashSet<>();
                    for (String tag : TAGS) {
                        if (random.nextBoolean() && members.contains(tag) != adding) {
                            changing.add(tag);
                        }
                    }
                    if (changing.isEmpty()) {
                        continue;
                    }
                    operation = adding
                            ? new MutationOperation.AddTags(candidate.target(), changing)
                            : new MutationOperation.RemoveTags(candidate.target(), changing);
                }
                running.applyAll(List.of(operation));
                operations.add(operation);
            }
            return operations;
        }

        AudienceState applyAll(List<MutationOperation> operations) {
            for (MutationOperation operation : operations) {
                switch (operation.kind()) {
                    case SET_ATTRIBUTE -> attributes.put(operation.target(),
                            ((MutationOperation.SetAttribute) operation).value());
                    case REMOVE_ATTRIBUTE -> attributes.remove(operation.target());
                    case ADD_TAGS -> group(operation.target()).addAll(((MutationOperation.AddTags) operation).tags());
                    case REMOVE_TAGS -> group(operation.target())
                            .removeAll(((MutationOperation.RemoveTags) operation).tags());
                    case SET_TAGS -> {
                        Set<String> members = group(operation.target());
                        members.clear();
                        members.addAll(((MutationOperation.SetTags) operation).tags());
                    }
                }
            }
            return this;
        }

        private Set<String> group(String name) {
            return tags.computeIfAbsent(name, g -> new HashSet<>());
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof AudienceState other)) {
                return false;
            }
            return attributes.equals(other.attributes) && normalized(tags).equals(normalized(other.tags));
        }

        @Override
        public int hashCode() {
            return attributes.hashCode();
        }

        private static Map<String, Set<String>> normalized(Map<String, Set<String>> tags) {
            Map<String, Set<String>> result = new HashMap<>();
            tags.forEach((group, members) -> {
                if (!members.isEmpty()) {
                    result.put(group, members);
                }
            });
            return result;
        }

        @Override
        public String toString() {
            return "AudienceState{attributes=" + attributes + ", tags=" + tags + "}";
        }
    }
}
