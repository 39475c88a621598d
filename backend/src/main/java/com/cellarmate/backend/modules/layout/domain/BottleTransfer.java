package com.cellarmate.backend.modules.layout.domain;

public interface BottleTransfer extends SlotTransfer {

    int wineId();

    String zoneId();
}
