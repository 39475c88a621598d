package com.cellarmate.backend.modules.moves.presentation.dto;

import java.util.Map;

public record MoveAnalysisResponse(
        Map<Integer, Integer> swapPartners,
        boolean hasDependencies,
        int relocationCount
) {
}
