package com.cellarmate.backend.modules.moves.domain;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

import com.cellarmate.backend.modules.layout.domain.SlotTransfer;

/**
 * Read/write relationships between the moves of one plan.
 */
public final class MoveRelations {

    private MoveRelations() {
    }

    public static Map<Integer, Integer> detectSwapPairs(List<? extends SlotTransfer> moves) {
        return detectSwapPairs(moves, null);
    }

    /**
     * Pairs index i with j when move i goes A to B and move j goes B to A.
     * Both indices are recorded. Pairing is first match in ascending index
     * order and each index joins at most one pair.
     *
     * @param typeFilter moves rejected by the filter are never paired; {@code null} accepts all
     */
    public static <T extends SlotTransfer> Map<Integer, Integer> detectSwapPairs(
            List<T> moves,
            Predicate<? super T> typeFilter
    ) {
        Map<Integer, Integer> partners = new LinkedHashMap<>();
        if (moves == null) {
            return partners;
        }
        for (int i = 0; i < moves.size(); i++) {
            if (partners.containsKey(i) || !accepts(moves.get(i), typeFilter)) {
                continue;
            }
            T first = moves.get(i);
            for (int j = i + 1; j < moves.size(); j++) {
                if (partners.containsKey(j) || !accepts(moves.get(j), typeFilter)) {
                    continue;
                }
                T second = moves.get(j);
                if (Objects.equals(first.from(), second.to()) && Objects.equals(first.to(), second.from())) {
                    partners.put(i, j);
                    partners.put(j, i);
                    break;
                }
            }
        }
        return partners;
    }

    /**
     * True when some relocation reads a slot that another relocation writes,
     * meaning the moves cannot be applied one by one in arbitrary order.
     */
    public static boolean hasMoveDependencies(List<? extends SlotTransfer> moves) {
        if (moves == null || moves.isEmpty()) {
            return false;
        }
        Set<String> sources = new HashSet<>();
        Set<String> targets = new HashSet<>();
        for (SlotTransfer move : moves) {
            if (move == null || !move.isRelocation()) {
                continue;
            }
            sources.add(move.from());
            targets.add(move.to());
        }
        for (String source : sources) {
            if (targets.contains(source)) {
                return true;
            }
        }
        return false;
    }

    private static <T extends SlotTransfer> boolean accepts(T move, Predicate<? super T> typeFilter) {
        return move != null && (typeFilter == null || typeFilter.test(move));
    }
}
