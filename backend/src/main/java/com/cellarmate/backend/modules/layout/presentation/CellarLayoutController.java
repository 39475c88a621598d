package com.cellarmate.backend.modules.layout.presentation;

import com.cellarmate.backend.modules.layout.application.LayoutSortService;
import com.cellarmate.backend.modules.layout.presentation.dto.SortPlanRequest;
import com.cellarmate.backend.modules.layout.presentation.dto.SortPlanResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/cellar/layout")
public class CellarLayoutController {

    private final LayoutSortService layoutSortService;

    public CellarLayoutController(LayoutSortService layoutSortService) {
        this.layoutSortService = layoutSortService;
    }

    @Operation(summary = "Compute a sort plan",
            description = "Returns the moves that turn the current layout into the target layout.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Plan computed"),
            @ApiResponse(responseCode = "400", description = "Duplicate slot or layout over the size limit"),
            @ApiResponse(responseCode = "422", description = "Invalid slot entries")
    })
    @PostMapping("/sort-plan")
    public ResponseEntity<SortPlanResponse> sortPlan(@Valid @RequestBody SortPlanRequest request) {
        return ResponseEntity.ok(layoutSortService.plan(request));
    }
}
