package com.cellarmate.backend.modules.moves.domain;

import java.util.List;

public record MovePlanValidation(
        boolean valid,
        List<MoveValidationError> errors,
        Summary summary
) {

    public MovePlanValidation {
        errors = List.copyOf(errors);
    }

    public record Summary(
            int totalMoves,
            int errorCount,
            int slotsNotFound,
            int duplicateInstances,
            int duplicateTargets,
            int occupiedTargets,
            int sourceMismatches,
            int noopMoves
    ) {
    }
}
