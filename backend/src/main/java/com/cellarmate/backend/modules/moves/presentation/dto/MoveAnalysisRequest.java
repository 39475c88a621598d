package com.cellarmate.backend.modules.moves.presentation.dto;

import java.util.List;

import com.cellarmate.backend.modules.moves.domain.SuggestionType;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record MoveAnalysisRequest(
        @NotNull(message = "suggestions is required")
        List<@NotNull @Valid SuggestionInput> suggestions,
        SuggestionType typeFilter
) {
}
