package com.cellarmate.backend.modules.layout.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import com.cellarmate.backend.global.error.ProblemException;
import com.cellarmate.backend.modules.layout.domain.MoveConfidence;
import com.cellarmate.backend.modules.layout.domain.MoveType;
import com.cellarmate.backend.modules.layout.domain.WineMove;
import com.cellarmate.backend.modules.layout.presentation.dto.CurrentSlotInput;
import com.cellarmate.backend.modules.layout.presentation.dto.SortPlanRequest;
import com.cellarmate.backend.modules.layout.presentation.dto.SortPlanResponse;
import com.cellarmate.backend.modules.layout.presentation.dto.TargetSlotInput;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LayoutSortServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T09:00:00Z");

    private LayoutSortService layoutSortService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        layoutSortService = new LayoutSortService(new LayoutAssembler(4), clock);
    }

    private static CurrentSlotInput bottle(String slotId, int wineId) {
        return new CurrentSlotInput(slotId, wineId, null, null, null);
    }

    private static TargetSlotInput wants(String slotId, int wineId) {
        return new TargetSlotInput(slotId, wineId, "Wine " + wineId, "zone-" + wineId, MoveConfidence.MEDIUM);
    }

    @Test
    @DisplayName("스왑 계획은 짝 정보와 스테이징 필요 여부를 함께 돌려준다")
    void swapPlanReportsPartnersAndStaging() {
        SortPlanResponse response = layoutSortService.plan(new SortPlanRequest(
                List.of(bottle("A", 1), bottle("B", 2)),
                List.of(wants("A", 2), wants("B", 1))
        ));

        assertThat(response.moves()).extracting(WineMove::moveType).containsOnly(MoveType.SWAP);
        assertThat(response.moves().get(0).wineName()).isEqualTo("Wine 2");
        assertThat(response.swapPartners()).containsEntry(0, 1).containsEntry(1, 0);
        assertThat(response.requiresStaging()).isTrue();
        assertThat(response.unresolvedSlots()).isEmpty();
        assertThat(response.plannedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("빈 칸으로만 옮기면 스테이징이 필요 없다")
    void directMovesNeedNoStaging() {
        SortPlanResponse response = layoutSortService.plan(new SortPlanRequest(
                List.of(bottle("A", 1)),
                List.of(wants("C", 1))
        ));

        assertThat(response.stats().directMoves()).isEqualTo(1);
        assertThat(response.requiresStaging()).isFalse();
        assertThat(response.swapPartners()).isEmpty();
    }

    @Test
    @DisplayName("셀러에 없는 와인을 요구하는 칸은 unresolvedSlots 로 보고된다")
    void unresolvedSlotsAreReported() {
        SortPlanResponse response = layoutSortService.plan(new SortPlanRequest(
                List.of(bottle("A", 1), bottle("B", 2)),
                List.of(wants("A", 1), wants("B", 9), wants("C", 2))
        ));

        assertThat(response.unresolvedSlots()).containsExactly("B");
        assertThat(response.stats().stayInPlace()).isEqualTo(1);
        assertThat(response.stats().totalMoves()).isEqualTo(1);
    }

    @Test
    @DisplayName("같은 칸이 두 번 나오면 DUPLICATE_SLOT")
    void duplicateSlotIsRejected() {
        SortPlanRequest request = new SortPlanRequest(
                List.of(bottle("A", 1), bottle("A ", 2)),
                List.of()
        );

        assertThatThrownBy(() -> layoutSortService.plan(request))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("DUPLICATE_SLOT");
    }

    @Test
    @DisplayName("설정된 칸 수를 넘으면 LAYOUT_TOO_LARGE")
    void oversizedLayoutIsRejected() {
        SortPlanRequest request = new SortPlanRequest(
                List.of(),
                List.of(wants("A", 1), wants("B", 1), wants("C", 1), wants("D", 1), wants("E", 1))
        );

        assertThatThrownBy(() -> layoutSortService.plan(request))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("LAYOUT_TOO_LARGE");
    }
}
