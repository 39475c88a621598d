package com.cellarmate.backend.modules.layout.presentation.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record SortPlanRequest(
        @NotNull(message = "current is required")
        List<@NotNull @Valid CurrentSlotInput> current,
        @NotNull(message = "target is required")
        List<@NotNull @Valid TargetSlotInput> target
) {
}
