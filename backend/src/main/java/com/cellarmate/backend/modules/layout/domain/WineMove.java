package com.cellarmate.backend.modules.layout.domain;

/**
 * One bottle relocation. {@code moveType} is descriptive only; every move is
 * executed through the same clear-sources-then-fill-targets pass.
 */
public record WineMove(
        int wineId,
        String wineName,
        String from,
        String to,
        String zoneId,
        MoveConfidence confidence,
        MoveType moveType
) implements BottleTransfer {

    static WineMove of(SlotTarget target, String from, String to, MoveType moveType) {
        return new WineMove(
                target.wineId(),
                target.wineName() != null ? target.wineName() : "",
                from,
                to,
                target.zoneId() != null ? target.zoneId() : "",
                target.confidence() != null ? target.confidence() : MoveConfidence.HIGH,
                moveType
        );
    }
}
