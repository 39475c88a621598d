package com.cellarmate.backend.modules.layout.domain;

import java.util.List;

public record SortPlan(List<WineMove> moves, SortStats stats) {

    public SortPlan {
        moves = List.copyOf(moves);
    }

    public boolean isEmpty() {
        return moves.isEmpty();
    }
}
