package com.cellarmate.backend.modules.layout.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the moves that turn a current cellar layout into a target layout.
 *
 * <p>Slots whose wine must change form a partial permutation: each displaced
 * target slot receives its wine from exactly one current slot. Walking
 * target-to-source links splits that permutation into chains, and the chain
 * length decides the move type (1 direct, 2 swap, 3+ cycle).
 *
 * <p>Sources are matched greedily: a target takes the first unclaimed slot
 * (in current-layout order) that holds its wine. No distance or zone
 * awareness. Slots already holding their target wine are never claimed.
 * Targets whose wine has no free bottle in the cellar are left out of the plan.
 *
 * <p>Every emitted move can be executed in one pass that clears all sources
 * before filling any target.
 */
public final class LayoutSorter {

    private static final int NO_SOURCE = -1;

    private LayoutSorter() {
    }

    public static SortPlan computeSortPlan(
            Map<String, SlotOccupant> currentLayout,
            Map<String, SlotTarget> targetLayout
    ) {
        SlotIndex index = SlotIndex.of(currentLayout.keySet(), targetLayout.keySet());
        int slotCount = index.size();

        SlotTarget[] desired = new SlotTarget[slotCount];
        BitSet displaced = new BitSet(slotCount);
        // A bottle already in its target slot is never a source for another target
        BitSet claimed = new BitSet(slotCount);
        List<Integer> displacedOrder = new ArrayList<>();
        int stayInPlace = 0;

        for (Map.Entry<String, SlotTarget> entry : targetLayout.entrySet()) {
            SlotTarget target = entry.getValue();
            if (target == null) {
                continue;
            }
            int slot = index.indexOf(entry.getKey());
            SlotOccupant occupant = currentLayout.get(entry.getKey());
            if (occupant != null && occupant.wineId() == target.wineId()) {
                claimed.set(slot);
                stayInPlace++;
                continue;
            }
            desired[slot] = target;
            displaced.set(slot);
            displacedOrder.add(slot);
        }

        Map<Integer, List<Integer>> slotsByWine = new HashMap<>();
        for (Map.Entry<String, SlotOccupant> entry : currentLayout.entrySet()) {
            SlotOccupant occupant = entry.getValue();
            if (occupant == null) {
                continue;
            }
            slotsByWine.computeIfAbsent(occupant.wineId(), wineId -> new ArrayList<>())
                    .add(index.indexOf(entry.getKey()));
        }

        int[] sourceOf = new int[slotCount];
        Arrays.fill(sourceOf, NO_SOURCE);
        for (int slot : displacedOrder) {
            List<Integer> candidates = slotsByWine.getOrDefault(desired[slot].wineId(), List.of());
            for (int candidate : candidates) {
                if (!claimed.get(candidate)) {
                    claimed.set(candidate);
                    sourceOf[slot] = candidate;
                    break;
                }
            }
        }

        List<WineMove> moves = new ArrayList<>();
        int directMoves = 0;
        int swaps = 0;
        int cycles = 0;
        BitSet visited = new BitSet(slotCount);

        for (int start : displacedOrder) {
            if (sourceOf[start] == NO_SOURCE || visited.get(start)) {
                continue;
            }
            List<Integer> chain = walkChain(start, sourceOf, displaced, visited);
            MoveType moveType = MoveType.forChainLength(chain.size());
            switch (moveType) {
                case DIRECT -> directMoves++;
                case SWAP -> swaps++;
                case CYCLE -> cycles++;
            }
            for (int slot : chain) {
                moves.add(WineMove.of(desired[slot], index.slotAt(sourceOf[slot]), index.slotAt(slot), moveType));
            }
        }

        SortStats stats = new SortStats(stayInPlace, directMoves, swaps, cycles, moves.size());
        return new SortPlan(moves, stats);
    }

    /**
     * Follows target -> source while the source is itself a displaced slot
     * that has not been walked yet. Returns the target slots in walk order.
     */
    private static List<Integer> walkChain(int start, int[] sourceOf, BitSet displaced, BitSet visited) {
        List<Integer> chain = new ArrayList<>();
        int current = start;
        while (!visited.get(current)) {
            visited.set(current);
            int source = sourceOf[current];
            if (source == NO_SOURCE) {
                break;
            }
            chain.add(current);
            if (!displaced.get(source) || visited.get(source)) {
                break;
            }
            current = source;
        }
        return chain;
    }
}
