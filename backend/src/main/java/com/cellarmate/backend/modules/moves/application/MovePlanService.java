package com.cellarmate.backend.modules.moves.application;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.UNPROCESSABLE_ENTITY;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.cellarmate.backend.global.error.ProblemException;
import com.cellarmate.backend.modules.layout.application.LayoutAssembler;
import com.cellarmate.backend.modules.layout.domain.SlotOccupant;
import com.cellarmate.backend.modules.moves.domain.CellarSnapshot;
import com.cellarmate.backend.modules.moves.domain.CellarSuggestion;
import com.cellarmate.backend.modules.moves.domain.MovePlanValidation;
import com.cellarmate.backend.modules.moves.domain.MovePlanValidator;
import com.cellarmate.backend.modules.moves.domain.MoveRelations;
import com.cellarmate.backend.modules.moves.domain.TwoPhaseMoveApplier;
import com.cellarmate.backend.modules.moves.presentation.dto.MoveAnalysisRequest;
import com.cellarmate.backend.modules.moves.presentation.dto.MoveAnalysisResponse;
import com.cellarmate.backend.modules.moves.presentation.dto.MoveInput;
import com.cellarmate.backend.modules.moves.presentation.dto.MoveSimulationRequest;
import com.cellarmate.backend.modules.moves.presentation.dto.MoveSimulationResponse;
import com.cellarmate.backend.modules.moves.presentation.dto.MoveSimulationResponse.SlotView;
import com.cellarmate.backend.modules.moves.presentation.dto.MoveValidationRequest;
import com.cellarmate.backend.modules.moves.presentation.dto.SlotStateInput;
import com.cellarmate.backend.modules.moves.presentation.dto.SuggestionInput;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class MovePlanService {

    private static final Logger log = LoggerFactory.getLogger(MovePlanService.class);

    private final LayoutAssembler layoutAssembler;
    private final Clock clock;

    public MovePlanService(LayoutAssembler layoutAssembler, Clock clock) {
        this.layoutAssembler = layoutAssembler;
        this.clock = clock;
    }

    public MoveAnalysisResponse analyze(MoveAnalysisRequest request) {
        List<CellarSuggestion> suggestions = request.suggestions().stream()
                .map(SuggestionInput::toSuggestion)
                .toList();
        Map<Integer, Integer> partners = request.typeFilter() == null
                ? MoveRelations.detectSwapPairs(suggestions)
                : MoveRelations.detectSwapPairs(suggestions, suggestion -> suggestion.type() == request.typeFilter());
        int relocations = (int) suggestions.stream().filter(CellarSuggestion::isRelocation).count();
        return new MoveAnalysisResponse(partners, MoveRelations.hasMoveDependencies(suggestions), relocations);
    }

    public MovePlanValidation validate(MoveValidationRequest request) {
        CellarSnapshot snapshot = toSnapshot(request.slots());
        MovePlanValidation validation = MovePlanValidator.validate(request.moves(), snapshot);
        if (!validation.valid()) {
            log.warn("Move plan rejected: {} error(s) across {} move(s)",
                    validation.summary().errorCount(), validation.summary().totalMoves());
        }
        return validation;
    }

    public MoveSimulationResponse simulate(MoveSimulationRequest request) {
        Map<String, SlotOccupant> current = layoutAssembler.currentLayout(request.current());
        List<MoveInput> moves = request.moves();

        CellarSnapshot.Builder snapshot = CellarSnapshot.builder(CellarSnapshot.fromLayout(current));
        moves.forEach(move -> snapshot.emptyIfAbsent(move.to()));

        MovePlanValidation validation = MovePlanValidator.validate(moves, snapshot.build());
        if (!validation.valid()) {
            log.warn("Simulation refused: {} validation error(s)", validation.summary().errorCount());
            throw new ProblemException(UNPROCESSABLE_ENTITY, "MOVE_PLAN_INVALID",
                    "Cannot apply moves: %d validation error(s) detected".formatted(validation.summary().errorCount()));
        }

        Map<String, SlotOccupant> projected = TwoPhaseMoveApplier.apply(current, moves);
        List<SlotView> layout = projected.entrySet().stream()
                .map(entry -> toSlotView(entry.getKey(), entry.getValue()))
                .toList();
        log.info("Simulated {} move(s) over {} occupied slot(s)", moves.size(), projected.size());

        return new MoveSimulationResponse(
                layout,
                moves.size(),
                MoveRelations.hasMoveDependencies(moves),
                OffsetDateTime.now(clock)
        );
    }

    private CellarSnapshot toSnapshot(List<SlotStateInput> slots) {
        CellarSnapshot.Builder builder = CellarSnapshot.builder();
        Set<String> seen = new HashSet<>();
        for (SlotStateInput slot : slots) {
            String slotId = slot.slotId().trim();
            if (!seen.add(slotId)) {
                throw new ProblemException(BAD_REQUEST, "DUPLICATE_SLOT",
                        "Slot %s appears more than once in the snapshot".formatted(slotId));
            }
            if (slot.wineId() == null) {
                builder.empty(slotId);
            } else {
                builder.occupied(slotId, slot.wineId());
            }
        }
        return builder.build();
    }

    private SlotView toSlotView(String slotId, SlotOccupant occupant) {
        return new SlotView(slotId, occupant.wineId(), occupant.wineName(), occupant.colour(), occupant.zoneId());
    }
}
