package com.cellarmate.backend.modules.layout.domain;

public enum MoveConfidence {
    HIGH,
    MEDIUM,
    LOW
}
