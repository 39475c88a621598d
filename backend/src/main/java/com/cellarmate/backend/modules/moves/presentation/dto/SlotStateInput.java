package com.cellarmate.backend.modules.moves.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * One slot of the cellar grid; {@code wineId} is omitted for an empty slot.
 */
public record SlotStateInput(
        @NotBlank(message = "slotId is required")
        String slotId,
        @Positive(message = "wineId must be positive")
        Integer wineId
) {
}
