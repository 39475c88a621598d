package com.cellarmate.backend.modules.moves.domain;

public enum MoveValidationErrorType {
    SLOT_NOT_FOUND,
    DUPLICATE_MOVE_INSTANCE,
    DUPLICATE_TARGET,
    TARGET_OCCUPIED,
    SOURCE_MISMATCH,
    NOOP_MOVE
}
