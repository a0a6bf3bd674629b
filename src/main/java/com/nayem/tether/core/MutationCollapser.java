package com.nayem.tether.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds a sequence of operations into the fewest operations with the same end
 * state.
 * <p>
 * Operations are processed in arrival order and folded per target. Attributes
 * and tag groups live in separate namespaces, so an attribute and a tag group
 * with the same name never interact.
 * </p>
 * <ul>
 * <li>Attributes: the last {@code set} or {@code remove} for a name wins.</li>
 * <li>Tag groups: a {@code set} replaces the group and later adds/removes edit
 * the replacement. Without a {@code set}, the group keeps per-tag adds and
 * removes. When {@link Mode#ANNIHILATE} is used, an add and a remove of the same
 * tag cancel out and the tag is left untouched; with {@link Mode#NET_EFFECT} the
 * later of the two wins.</li>
 * </ul>
 * The result keeps the order in which each target was last touched.
 */
public final class MutationCollapser {

    public enum Mode {
        /**
         * Opposite tag edits cancel. Only valid while none of the operations has
         * been sent, since a sent add may already be applied remotely.
         */
        ANNIHILATE,

        /**
         * The later tag edit wins. Safe to replay after a partial delivery.
         */
        NET_EFFECT
    }

    private MutationCollapser() {
    }

    public static List<MutationOperation> collapse(Collection<MutationOperation> operations, Mode mode) {
        Map<TargetKey, Slot> slots = new LinkedHashMap<>();

        for (MutationOperation operation : operations) {
            TargetKey key = new TargetKey(operation.kind().namespace(), operation.target());
            Slot slot = slots.remove(key);
            if (slot == null) {
                slot = new Slot();
            }
            fold(slot, operation, mode);
            slots.put(key, slot);
        }

        List<MutationOperation> collapsed = new ArrayList<>();
        slots.forEach((key, slot) -> slot.emit(key.target(), collapsed));
        return collapsed;
    }

    /**
     * Convenience for folding a pending list with newly appended operations.
     */
    public static List<MutationOperation> collapse(List<MutationOperation> pending,
            List<MutationOperation> appended, Mode mode) {
        List<MutationOperation> all = new ArrayList<>(pending.size() + appended.size());
        all.addAll(pending);
        all.addAll(appended);
        return collapse(all, mode);
    }

    private static void fold(Slot slot, MutationOperation operation, Mode mode) {
        switch (operation.kind()) {
            case SET_ATTRIBUTE, REMOVE_ATTRIBUTE -> slot.attribute = operation;
            case SET_TAGS -> {
                slot.set = new LinkedHashSet<>(((MutationOperation.SetTags) operation).tags());
                slot.adds.clear();
                slot.removes.clear();
            }
            case ADD_TAGS -> {
                Set<String> tags = ((MutationOperation.AddTags) operation).tags();
                if (slot.set != null) {
                    slot.set.addAll(tags);
                } else {
                    applyDelta(tags, slot.adds, slot.removes, mode);
                }
            }
            case REMOVE_TAGS -> {
                Set<String> tags = ((MutationOperation.RemoveTags) operation).tags();
                if (slot.set != null) {
                    slot.set.removeAll(tags);
                } else {
                    applyDelta(tags, slot.removes, slot.adds, mode);
                }
            }
        }
    }

    private static void applyDelta(Set<String> tags, Set<String> target, Set<String> opposite, Mode mode) {
        for (String tag : tags) {
            boolean cancelled = opposite.remove(tag);
            if (cancelled && mode == Mode.ANNIHILATE) {
                continue;
            }
            // re-insert so the set keeps the latest touch order
            target.remove(tag);
            target.add(tag);
        }
    }

    private record TargetKey(MutationOperation.Namespace namespace, String target) {
    }

    private static final class Slot {
        private MutationOperation attribute;
        private Set<String> set;
        private final Set<String> adds = new LinkedHashSet<>();
        private final Set<String> removes = new LinkedHashSet<>();

        void emit(String target, List<MutationOperation> out) {
            if (attribute != null) {
                out.add(attribute);
                return;
            }
            if (set != null) {
                out.add(new MutationOperation.SetTags(target, set));
                return;
            }
            if (!adds.isEmpty()) {
                out.add(new MutationOperation.AddTags(target, adds));
            }
            if (!removes.isEmpty()) {
                out.add(new MutationOperation.RemoveTags(target, removes));
            }
        }
    }
}
