package com.cellarmate.backend.modules.moves.presentation.dto;

import java.util.List;

import com.cellarmate.backend.modules.layout.presentation.dto.CurrentSlotInput;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

public record MoveSimulationRequest(
        @NotNull(message = "current is required")
        List<@NotNull @Valid CurrentSlotInput> current,
        @NotEmpty(message = "moves must not be empty")
        List<@NotNull @Valid MoveInput> moves
) {
}
