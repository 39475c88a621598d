package com.cellarmate.backend.modules.moves.domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.cellarmate.backend.modules.layout.domain.BottleTransfer;
import com.cellarmate.backend.modules.layout.domain.SlotOccupant;

/**
 * Applies a move plan to a copy of a layout: phase 1 empties every source,
 * phase 2 fills every target. Swaps and cycles need no staging slot this way.
 * The input layout is never modified.
 */
public final class TwoPhaseMoveApplier {

    private TwoPhaseMoveApplier() {
    }

    public static Map<String, SlotOccupant> apply(
            Map<String, SlotOccupant> currentLayout,
            List<? extends BottleTransfer> moves
    ) {
        Map<String, SlotOccupant> layout = new LinkedHashMap<>(currentLayout);
        layout.values().removeIf(occupant -> occupant == null);

        List<SlotOccupant> inTransit = new ArrayList<>(moves.size());
        for (BottleTransfer move : moves) {
            SlotOccupant occupant = layout.remove(move.from());
            if (occupant == null) {
                throw new IllegalStateException("Source slot %s is empty or already cleared".formatted(move.from()));
            }
            if (occupant.wineId() != move.wineId()) {
                throw new IllegalStateException("Source slot %s holds wine %d, not wine %d"
                        .formatted(move.from(), occupant.wineId(), move.wineId()));
            }
            inTransit.add(occupant);
        }

        for (int i = 0; i < moves.size(); i++) {
            BottleTransfer move = moves.get(i);
            if (layout.containsKey(move.to())) {
                throw new IllegalStateException("Target slot %s is still occupied".formatted(move.to()));
            }
            layout.put(move.to(), inTransit.get(i).withZone(move.zoneId()));
        }
        return layout;
    }
}
