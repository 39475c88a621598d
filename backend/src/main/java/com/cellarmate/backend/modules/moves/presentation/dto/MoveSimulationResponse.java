package com.cellarmate.backend.modules.moves.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

public record MoveSimulationResponse(
        List<SlotView> layout,
        int moved,
        boolean requiresStaging,
        OffsetDateTime simulatedAt
) {

    public record SlotView(
            String slotId,
            int wineId,
            String wineName,
            String colour,
            String zoneId
    ) {
    }
}
