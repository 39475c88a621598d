package com.cellarmate.backend.modules.moves.presentation.dto;

import com.cellarmate.backend.modules.moves.domain.CellarSuggestion;
import com.cellarmate.backend.modules.moves.domain.SuggestionType;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record SuggestionInput(
        @NotNull(message = "type is required")
        SuggestionType type,
        Integer wineId,
        String wineName,
        @NotBlank(message = "from is required")
        String from,
        @NotBlank(message = "to is required")
        String to
) {

    public SuggestionInput {
        from = from == null ? null : from.trim();
        to = to == null ? null : to.trim();
    }

    public CellarSuggestion toSuggestion() {
        return new CellarSuggestion(type, wineId, wineName, from, to);
    }
}
