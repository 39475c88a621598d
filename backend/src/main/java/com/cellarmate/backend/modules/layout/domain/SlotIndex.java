package com.cellarmate.backend.modules.layout.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dense numbering of every slot seen in either layout, so planning can run on
 * int arrays and bitsets instead of string-keyed maps.
 */
final class SlotIndex {

    private final Map<String, Integer> positions;
    private final List<String> slots;

    private SlotIndex(Map<String, Integer> positions, List<String> slots) {
        this.positions = positions;
        this.slots = slots;
    }

    static SlotIndex of(Collection<String> first, Collection<String> second) {
        int expected = first.size() + second.size();
        Map<String, Integer> positions = new HashMap<>(Math.max(16, expected * 2));
        List<String> slots = new ArrayList<>(expected);
        register(first, positions, slots);
        register(second, positions, slots);
        return new SlotIndex(positions, slots);
    }

    private static void register(Collection<String> slotIds, Map<String, Integer> positions, List<String> slots) {
        for (String slotId : slotIds) {
            if (positions.putIfAbsent(slotId, slots.size()) == null) {
                slots.add(slotId);
            }
        }
    }

    int indexOf(String slotId) {
        Integer position = positions.get(slotId);
        if (position == null) {
            throw new IllegalArgumentException("Unknown slot " + slotId);
        }
        return position;
    }

    String slotAt(int index) {
        return slots.get(index);
    }

    int size() {
        return slots.size();
    }
}
