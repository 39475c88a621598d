package com.cellarmate.backend.modules.moves.domain;

import static com.cellarmate.backend.support.Layouts.current;
import static com.cellarmate.backend.support.Layouts.target;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import com.cellarmate.backend.modules.layout.domain.LayoutSorter;
import com.cellarmate.backend.modules.layout.domain.MoveConfidence;
import com.cellarmate.backend.modules.layout.domain.MoveType;
import com.cellarmate.backend.modules.layout.domain.SlotOccupant;
import com.cellarmate.backend.modules.layout.domain.SlotTarget;
import com.cellarmate.backend.modules.layout.domain.SortPlan;
import com.cellarmate.backend.modules.layout.domain.WineMove;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TwoPhaseMoveApplierTest {

    @Test
    @DisplayName("3칸 순환도 임시 칸 없이 적용된다")
    void cycleNeedsNoStagingSlot() {
        Map<String, SlotOccupant> before = current("A", 1, "B", 2, "C", 3);
        SortPlan plan = LayoutSorter.computeSortPlan(before, target("A", 2, "B", 3, "C", 1));

        Map<String, SlotOccupant> after = TwoPhaseMoveApplier.apply(before, plan.moves());

        assertThat(wineIds(after)).containsExactlyInAnyOrderEntriesOf(Map.of("A", 2, "B", 3, "C", 1));
        assertThat(wineIds(before)).containsExactlyInAnyOrderEntriesOf(Map.of("A", 1, "B", 2, "C", 3));
    }

    @Test
    @DisplayName("옮겨진 병은 이름과 색을 유지하고 이동의 구역을 받는다")
    void movedBottleKeepsDetailsAndTakesZone() {
        Map<String, SlotOccupant> before = new LinkedHashMap<>();
        before.put("A", new SlotOccupant(4, "Chianti", "red", "tuscany"));
        WineMove move = new WineMove(4, "Chianti", "A", "B", "italy-reds", MoveConfidence.MEDIUM, MoveType.DIRECT);

        Map<String, SlotOccupant> after = TwoPhaseMoveApplier.apply(before, List.of(move));

        assertThat(after).containsOnlyKeys("B");
        assertThat(after.get("B")).isEqualTo(new SlotOccupant(4, "Chianti", "red", "italy-reds"));
    }

    @Test
    @DisplayName("출발 칸이 비어 있으면 적용하지 않는다")
    void emptySourceFails() {
        WineMove move = new WineMove(4, "", "A", "B", "", MoveConfidence.HIGH, MoveType.DIRECT);

        assertThatThrownBy(() -> TwoPhaseMoveApplier.apply(current("C", 4), List.of(move)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("A");
    }

    @Test
    @DisplayName("비워지지 않은 칸에 쓰려고 하면 실패한다")
    void occupiedTargetFails() {
        WineMove move = new WineMove(4, "", "A", "B", "", MoveConfidence.HIGH, MoveType.DIRECT);

        assertThatThrownBy(() -> TwoPhaseMoveApplier.apply(current("A", 4, "B", 5), List.of(move)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("still occupied");
    }

    @Test
    @DisplayName("계획을 적용한 뒤 다시 계획하면 이동이 없다")
    void replanningAfterApplyIsEmpty() {
        for (long seed = 0; seed < 40; seed++) {
            Random random = new Random(seed);
            List<String> slots = new ArrayList<>();
            for (int row = 1; row <= 4; row++) {
                for (int col = 1; col <= 6; col++) {
                    slots.add("R" + row + "C" + col);
                }
            }

            Map<String, SlotOccupant> before = new LinkedHashMap<>();
            List<Integer> bottles = new ArrayList<>();
            for (String slot : slots) {
                if (random.nextInt(4) > 0) {
                    int wineId = 1 + random.nextInt(6);
                    before.put(slot, SlotOccupant.of(wineId));
                    bottles.add(wineId);
                }
            }

            List<String> shuffledSlots = new ArrayList<>(slots);
            Collections.shuffle(shuffledSlots, random);
            Map<String, SlotTarget> goal = new LinkedHashMap<>();
            for (int i = 0; i < bottles.size(); i++) {
                goal.put(shuffledSlots.get(i), SlotTarget.of(bottles.get(i)));
            }

            SortPlan plan = LayoutSorter.computeSortPlan(before, goal);
            assertThat(plan.moves()).extracting(WineMove::from).doesNotHaveDuplicates();
            assertThat(plan.moves()).extracting(WineMove::to).doesNotHaveDuplicates();
            assertThat(plan.stats().stayInPlace() + plan.stats().totalMoves()).isEqualTo(goal.size());

            Map<String, SlotOccupant> after = TwoPhaseMoveApplier.apply(before, plan.moves());

            assertThat(wineIds(after)).as("seed %d", seed)
                    .containsExactlyInAnyOrderEntriesOf(goal.entrySet().stream()
                            .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().wineId())));
            assertThat(LayoutSorter.computeSortPlan(after, goal).moves()).as("seed %d", seed).isEmpty();
        }
    }

    private static Map<String, Integer> wineIds(Map<String, SlotOccupant> layout) {
        return layout.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().wineId()));
    }
}
