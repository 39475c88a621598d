package com.cellarmate.backend.modules.layout.domain;

public enum MoveType {
    DIRECT,
    SWAP,
    CYCLE;

    public static MoveType forChainLength(int length) {
        if (length < 1) {
            throw new IllegalArgumentException("chain length must be positive");
        }
        if (length == 1) {
            return DIRECT;
        }
        return length == 2 ? SWAP : CYCLE;
    }
}
