package com.cellarmate.backend.modules.layout.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.cellarmate.backend.modules.layout.domain.LayoutSorter;
import com.cellarmate.backend.modules.layout.domain.SlotOccupant;
import com.cellarmate.backend.modules.layout.domain.SlotTarget;
import com.cellarmate.backend.modules.layout.domain.SortPlan;
import com.cellarmate.backend.modules.layout.domain.SortStats;
import com.cellarmate.backend.modules.layout.domain.WineMove;
import com.cellarmate.backend.modules.layout.presentation.dto.SortPlanRequest;
import com.cellarmate.backend.modules.layout.presentation.dto.SortPlanResponse;
import com.cellarmate.backend.modules.moves.domain.MoveRelations;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class LayoutSortService {

    private static final Logger log = LoggerFactory.getLogger(LayoutSortService.class);

    private final LayoutAssembler layoutAssembler;
    private final Clock clock;

    public LayoutSortService(LayoutAssembler layoutAssembler, Clock clock) {
        this.layoutAssembler = layoutAssembler;
        this.clock = clock;
    }

    public SortPlanResponse plan(SortPlanRequest request) {
        Map<String, SlotOccupant> current = layoutAssembler.currentLayout(request.current());
        Map<String, SlotTarget> target = layoutAssembler.targetLayout(request.target());

        SortPlan plan = LayoutSorter.computeSortPlan(current, target);
        if (plan.isEmpty()) {
            log.debug("Current layout already matches the target for {} slot(s)", target.size());
        }
        SortStats stats = plan.stats();
        List<String> unresolved = findUnresolvedSlots(current, target, plan.moves());
        if (!unresolved.isEmpty()) {
            log.warn("{} target slot(s) have no bottle in the cellar and were left out of the plan: {}",
                    unresolved.size(), unresolved);
        }

        boolean requiresStaging = MoveRelations.hasMoveDependencies(plan.moves());
        log.info("Sort plan: {} moves ({} direct, {} swaps, {} cycles), {} in place, staging={}",
                stats.totalMoves(), stats.directMoves(), stats.swaps(), stats.cycles(), stats.stayInPlace(),
                requiresStaging);

        return new SortPlanResponse(
                plan.moves(),
                stats,
                unresolved,
                MoveRelations.detectSwapPairs(plan.moves()),
                requiresStaging,
                OffsetDateTime.now(clock)
        );
    }

    /**
     * Target slots that neither keep their wine nor receive one. Their wine is
     * not in the cellar and has to be added before the slot can be filled.
     */
    private List<String> findUnresolvedSlots(
            Map<String, SlotOccupant> current,
            Map<String, SlotTarget> target,
            List<WineMove> moves
    ) {
        Set<String> filled = new HashSet<>();
        for (WineMove move : moves) {
            filled.add(move.to());
        }
        return target.entrySet().stream()
                .filter(entry -> !filled.contains(entry.getKey()))
                .filter(entry -> {
                    SlotOccupant occupant = current.get(entry.getKey());
                    return occupant == null || occupant.wineId() != entry.getValue().wineId();
                })
                .map(Map.Entry::getKey)
                .toList();
    }
}
