package com.cellarmate.backend.modules.moves.presentation.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record MoveValidationRequest(
        @NotNull(message = "slots is required")
        List<@NotNull @Valid SlotStateInput> slots,
        @NotNull(message = "moves is required")
        List<@NotNull @Valid MoveInput> moves
) {
}
