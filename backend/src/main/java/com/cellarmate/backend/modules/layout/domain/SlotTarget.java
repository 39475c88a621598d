package com.cellarmate.backend.modules.layout.domain;

public record SlotTarget(
        int wineId,
        String wineName,
        String zoneId,
        MoveConfidence confidence
) {

    public static SlotTarget of(int wineId) {
        return new SlotTarget(wineId, null, null, null);
    }
}
