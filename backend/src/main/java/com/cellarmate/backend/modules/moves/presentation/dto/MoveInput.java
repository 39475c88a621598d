package com.cellarmate.backend.modules.moves.presentation.dto;

import com.cellarmate.backend.modules.layout.domain.BottleTransfer;
import com.cellarmate.backend.modules.layout.domain.MoveConfidence;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record MoveInput(
        @Positive(message = "wineId must be positive")
        int wineId,
        String wineName,
        @NotBlank(message = "from is required")
        String from,
        @NotBlank(message = "to is required")
        String to,
        String zoneId,
        MoveConfidence confidence
) implements BottleTransfer {

    public MoveInput {
        from = from == null ? null : from.trim();
        to = to == null ? null : to.trim();
    }
}
