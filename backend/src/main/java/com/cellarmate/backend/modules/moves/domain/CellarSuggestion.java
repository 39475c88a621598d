package com.cellarmate.backend.modules.moves.domain;

import com.cellarmate.backend.modules.layout.domain.SlotTransfer;

/**
 * A move proposed by any suggestion source. Only {@link SuggestionType#MOVE}
 * entries are relocations; the rest are hints a person acts on by hand.
 */
public record CellarSuggestion(
        SuggestionType type,
        Integer wineId,
        String wineName,
        String from,
        String to
) implements SlotTransfer {

    @Override
    public boolean isRelocation() {
        return type != null && type.isRelocation();
    }
}
