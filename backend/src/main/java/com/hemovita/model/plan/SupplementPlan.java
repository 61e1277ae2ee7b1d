package com.hemovita.model.plan;

import com.hemovita.model.enums.Slot;

import java.util.*;

/**
 * Supplement keys per time slot.
 *
 * Append-only while the scheduler builds it; slot contents keep insertion
 * order and never hold the same key twice. Keys forced into the last slot
 * despite a conflict are recorded in forcedPlacements.
 */
public final class SupplementPlan {

    private final Map<Slot, List<String>> slots = new EnumMap<>(Slot.class);
    private final List<String> forcedPlacements = new ArrayList<>();

    public SupplementPlan() {
        for (Slot slot : Slot.values()) {
            slots.put(slot, new ArrayList<>());
        }
    }

    /**
     * Appends a key to a slot. Returns false when the slot already holds it.
     */
    public boolean add(Slot slot, String key) {
        List<String> items = slots.get(slot);
        if (items.contains(key)) {
            return false;
        }
        items.add(key);
        return true;
    }

    public void addForced(String key) {
        if (add(Slot.last(), key)) {
            forcedPlacements.add(key);
        }
    }

    public List<String> keysIn(Slot slot) {
        return Collections.unmodifiableList(slots.get(slot));
    }

    public boolean contains(Slot slot, String key) {
        return slots.get(slot).contains(key);
    }

    /**
     * First slot, in schedule order, that holds the key.
     */
    public Optional<Slot> slotOf(String key) {
        for (Slot slot : Slot.values()) {
            if (slots.get(slot).contains(key)) {
                return Optional.of(slot);
            }
        }
        return Optional.empty();
    }

    public Set<Slot> slotsOf(String key) {
        Set<Slot> found = EnumSet.noneOf(Slot.class);
        for (Slot slot : Slot.values()) {
            if (slots.get(slot).contains(key)) {
                found.add(slot);
            }
        }
        return found;
    }

    public boolean isEmpty() {
        return slots.values().stream().allMatch(List::isEmpty);
    }

    public List<String> forcedPlacements() {
        return Collections.unmodifiableList(forcedPlacements);
    }

    /**
     * Slot name -> keys, every slot present, in schedule order.
     */
    public Map<String, List<String>> asMap() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (Slot slot : Slot.values()) {
            out.put(slot.getValue(), List.copyOf(slots.get(slot)));
        }
        return out;
    }
}
