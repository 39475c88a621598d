package com.cellarmate.backend.modules.layout.application;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.cellarmate.backend.global.error.ProblemException;
import com.cellarmate.backend.modules.layout.domain.SlotOccupant;
import com.cellarmate.backend.modules.layout.domain.SlotTarget;
import com.cellarmate.backend.modules.layout.presentation.dto.CurrentSlotInput;
import com.cellarmate.backend.modules.layout.presentation.dto.TargetSlotInput;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Turns request slot lists into ordered layouts, one entry per slot.
 */
@Component
public class LayoutAssembler {

    private final int maxSlots;

    public LayoutAssembler(@Value("${app.layout.max-slots:2000}") int maxSlots) {
        if (maxSlots <= 0) {
            throw new IllegalArgumentException("app.layout.max-slots must be positive");
        }
        this.maxSlots = maxSlots;
    }

    public Map<String, SlotOccupant> currentLayout(List<CurrentSlotInput> inputs) {
        return assemble("current", inputs, CurrentSlotInput::slotId, CurrentSlotInput::toOccupant);
    }

    public Map<String, SlotTarget> targetLayout(List<TargetSlotInput> inputs) {
        return assemble("target", inputs, TargetSlotInput::slotId, TargetSlotInput::toTarget);
    }

    private <I, V> Map<String, V> assemble(
            String side,
            List<I> inputs,
            Function<I, String> slotId,
            Function<I, V> value
    ) {
        if (inputs.size() > maxSlots) {
            throw new ProblemException(BAD_REQUEST, "LAYOUT_TOO_LARGE",
                    "%s layout has %d slots, limit is %d".formatted(side, inputs.size(), maxSlots));
        }
        Map<String, V> layout = new LinkedHashMap<>();
        for (I input : inputs) {
            String slot = slotId.apply(input).trim();
            if (layout.putIfAbsent(slot, value.apply(input)) != null) {
                throw new ProblemException(BAD_REQUEST, "DUPLICATE_SLOT",
                        "Slot %s appears more than once in the %s layout".formatted(slot, side));
            }
        }
        return layout;
    }
}
