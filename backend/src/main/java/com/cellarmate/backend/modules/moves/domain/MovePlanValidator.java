package com.cellarmate.backend.modules.moves.domain;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.cellarmate.backend.modules.layout.domain.BottleTransfer;

/**
 * Checks a move plan against the cellar it is about to run on.
 *
 * <ul>
 *   <li>source and target slots exist</li>
 *   <li>each (wine, source slot) instance moves once</li>
 *   <li>each target slot is written once</li>
 *   <li>a target is empty or vacated by some move of the same plan</li>
 *   <li>the source holds the wine being moved</li>
 *   <li>no move targets its own source</li>
 * </ul>
 */
public final class MovePlanValidator {

    private MovePlanValidator() {
    }

    public static MovePlanValidation validate(List<? extends BottleTransfer> moves, CellarSnapshot snapshot) {
        List<MoveValidationError> errors = new ArrayList<>();
        Set<String> vacated = new HashSet<>();
        for (BottleTransfer move : moves) {
            if (!Objects.equals(move.from(), move.to())) {
                vacated.add(move.from());
            }
        }

        Set<String> movedInstances = new HashSet<>();
        Set<String> usedTargets = new HashSet<>();
        for (int i = 0; i < moves.size(); i++) {
            BottleTransfer move = moves.get(i);
            String from = move.from();
            String to = move.to();
            int wineId = move.wineId();

            if (Objects.equals(from, to)) {
                errors.add(MoveValidationError.noop(i, from, wineId));
                continue;
            }

            boolean sourceExists = snapshot.contains(from);
            boolean targetExists = snapshot.contains(to);
            if (!sourceExists) {
                errors.add(MoveValidationError.slotNotFound(i, from, wineId));
            }
            if (!targetExists) {
                errors.add(MoveValidationError.slotNotFound(i, to, wineId));
            }

            if (!movedInstances.add(wineId + "@" + from)) {
                errors.add(MoveValidationError.duplicateInstance(i, from, wineId));
            }
            if (!usedTargets.add(to)) {
                errors.add(MoveValidationError.duplicateTarget(i, to, wineId));
            }

            if (sourceExists) {
                Integer actual = snapshot.occupantOf(from);
                if (actual == null || actual != wineId) {
                    errors.add(MoveValidationError.sourceMismatch(i, from, wineId, actual));
                }
            }
            if (targetExists) {
                Integer occupant = snapshot.occupantOf(to);
                if (occupant != null && !vacated.contains(to)) {
                    errors.add(MoveValidationError.targetOccupied(i, to, wineId, occupant));
                }
            }
        }

        return new MovePlanValidation(errors.isEmpty(), errors, summarize(moves.size(), errors));
    }

    private static MovePlanValidation.Summary summarize(int totalMoves, List<MoveValidationError> errors) {
        Map<MoveValidationErrorType, Integer> counts = new EnumMap<>(MoveValidationErrorType.class);
        for (MoveValidationError error : errors) {
            counts.merge(error.type(), 1, Integer::sum);
        }
        return new MovePlanValidation.Summary(
                totalMoves,
                errors.size(),
                counts.getOrDefault(MoveValidationErrorType.SLOT_NOT_FOUND, 0),
                counts.getOrDefault(MoveValidationErrorType.DUPLICATE_MOVE_INSTANCE, 0),
                counts.getOrDefault(MoveValidationErrorType.DUPLICATE_TARGET, 0),
                counts.getOrDefault(MoveValidationErrorType.TARGET_OCCUPIED, 0),
                counts.getOrDefault(MoveValidationErrorType.SOURCE_MISMATCH, 0),
                counts.getOrDefault(MoveValidationErrorType.NOOP_MOVE, 0)
        );
    }
}
