package com.cellarmate.backend.modules.moves.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MoveValidationError(
        MoveValidationErrorType type,
        int moveIndex,
        String slot,
        Integer wineId,
        Integer expectedWineId,
        Integer actualWineId,
        String message
) {

    static MoveValidationError slotNotFound(int moveIndex, String slot, int wineId) {
        return new MoveValidationError(MoveValidationErrorType.SLOT_NOT_FOUND, moveIndex, slot, wineId, null, null,
                "Slot %s does not exist in this cellar".formatted(slot));
    }

    static MoveValidationError duplicateInstance(int moveIndex, String from, int wineId) {
        return new MoveValidationError(MoveValidationErrorType.DUPLICATE_MOVE_INSTANCE, moveIndex, from, wineId, null, null,
                "Wine %d in slot %s is moved more than once".formatted(wineId, from));
    }

    static MoveValidationError duplicateTarget(int moveIndex, String to, int wineId) {
        return new MoveValidationError(MoveValidationErrorType.DUPLICATE_TARGET, moveIndex, to, wineId, null, null,
                "Slot %s is the target of more than one move".formatted(to));
    }

    static MoveValidationError targetOccupied(int moveIndex, String to, int wineId, int occupantWineId) {
        return new MoveValidationError(MoveValidationErrorType.TARGET_OCCUPIED, moveIndex, to, wineId, null, occupantWineId,
                "Slot %s holds wine %d and is not vacated by this plan".formatted(to, occupantWineId));
    }

    static MoveValidationError sourceMismatch(int moveIndex, String from, int wineId, Integer actualWineId) {
        String detail = actualWineId == null
                ? "Slot %s is empty, expected wine %d".formatted(from, wineId)
                : "Slot %s holds wine %d, expected wine %d".formatted(from, actualWineId, wineId);
        return new MoveValidationError(MoveValidationErrorType.SOURCE_MISMATCH, moveIndex, from, wineId, wineId, actualWineId, detail);
    }

    static MoveValidationError noop(int moveIndex, String slot, int wineId) {
        return new MoveValidationError(MoveValidationErrorType.NOOP_MOVE, moveIndex, slot, wineId, null, null,
                "Move of wine %d from %s to itself".formatted(wineId, slot));
    }
}
