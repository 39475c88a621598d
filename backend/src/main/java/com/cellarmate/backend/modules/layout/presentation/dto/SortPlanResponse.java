package com.cellarmate.backend.modules.layout.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import com.cellarmate.backend.modules.layout.domain.SortStats;
import com.cellarmate.backend.modules.layout.domain.WineMove;

public record SortPlanResponse(
        List<WineMove> moves,
        SortStats stats,
        List<String> unresolvedSlots,
        Map<Integer, Integer> swapPartners,
        boolean requiresStaging,
        OffsetDateTime plannedAt
) {
}
