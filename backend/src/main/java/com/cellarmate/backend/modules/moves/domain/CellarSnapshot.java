package com.cellarmate.backend.modules.moves.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.cellarmate.backend.modules.layout.domain.SlotOccupant;

/**
 * Slots that exist in the cellar grid and the wine each one holds right now.
 * Empty slots are present with no wine.
 */
public final class CellarSnapshot {

    private final Map<String, Integer> occupancy;

    private CellarSnapshot(Map<String, Integer> occupancy) {
        this.occupancy = Collections.unmodifiableMap(occupancy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a builder pre-filled with an existing snapshot.
     */
    public static Builder builder(CellarSnapshot base) {
        Builder builder = new Builder();
        builder.occupancy.putAll(base.occupancy);
        return builder;
    }

    public static CellarSnapshot fromLayout(Map<String, SlotOccupant> layout) {
        Builder builder = builder();
        layout.forEach((slotId, occupant) -> {
            if (occupant == null) {
                builder.empty(slotId);
            } else {
                builder.occupied(slotId, occupant.wineId());
            }
        });
        return builder.build();
    }

    public boolean contains(String slotId) {
        return occupancy.containsKey(slotId);
    }

    /**
     * @return the wine in the slot, or {@code null} when the slot is empty or unknown
     */
    public Integer occupantOf(String slotId) {
        return occupancy.get(slotId);
    }

    public static final class Builder {

        private final Map<String, Integer> occupancy = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder occupied(String slotId, int wineId) {
            occupancy.put(slotId, wineId);
            return this;
        }

        public Builder empty(String slotId) {
            occupancy.put(slotId, null);
            return this;
        }

        /**
         * Registers the slot as empty unless it is already known.
         */
        public Builder emptyIfAbsent(String slotId) {
            if (!occupancy.containsKey(slotId)) {
                occupancy.put(slotId, null);
            }
            return this;
        }

        public CellarSnapshot build() {
            return new CellarSnapshot(new LinkedHashMap<>(occupancy));
        }
    }
}
