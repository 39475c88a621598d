package com.cellarmate.backend.modules.layout.presentation.dto;

import com.cellarmate.backend.modules.layout.domain.MoveConfidence;
import com.cellarmate.backend.modules.layout.domain.SlotTarget;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record TargetSlotInput(
        @NotBlank(message = "slotId is required")
        String slotId,
        @Positive(message = "wineId must be positive")
        int wineId,
        String wineName,
        String zoneId,
        MoveConfidence confidence
) {

    public SlotTarget toTarget() {
        return new SlotTarget(wineId, wineName, zoneId, confidence);
    }
}
