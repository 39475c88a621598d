package com.cellarmate.backend.modules.layout.domain;

public record SlotOccupant(
        int wineId,
        String wineName,
        String colour,
        String zoneId
) {

    public static SlotOccupant of(int wineId) {
        return new SlotOccupant(wineId, null, null, null);
    }

    public SlotOccupant withZone(String newZoneId) {
        if (newZoneId == null || newZoneId.isBlank()) {
            return this;
        }
        return new SlotOccupant(wineId, wineName, colour, newZoneId);
    }
}
