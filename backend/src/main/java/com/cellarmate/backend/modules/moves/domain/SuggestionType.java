package com.cellarmate.backend.modules.moves.domain;

public enum SuggestionType {
    MOVE,
    MANUAL;

    public boolean isRelocation() {
        return this == MOVE;
    }
}
