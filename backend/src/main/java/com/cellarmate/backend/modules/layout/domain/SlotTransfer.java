package com.cellarmate.backend.modules.layout.domain;

/**
 * Anything that relocates the content of one slot into another.
 */
public interface SlotTransfer {

    String from();

    String to();

    /**
     * Non-relocation entries (manual hints, advisory notes) carry slots for display only.
     */
    default boolean isRelocation() {
        return true;
    }
}
