package com.cellarmate.backend.modules.layout.domain;

/**
 * {@code swaps} and {@code cycles} count chains, not the moves inside them.
 */
public record SortStats(
        int stayInPlace,
        int directMoves,
        int swaps,
        int cycles,
        int totalMoves
) {
}
