package com.cellarmate.backend.modules.layout.presentation.dto;

import com.cellarmate.backend.modules.layout.domain.SlotOccupant;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record CurrentSlotInput(
        @NotBlank(message = "slotId is required")
        String slotId,
        @Positive(message = "wineId must be positive")
        int wineId,
        String wineName,
        String colour,
        String zoneId
) {

    public SlotOccupant toOccupant() {
        return new SlotOccupant(wineId, wineName, colour, zoneId);
    }
}
