package com.cellarmate.backend.modules.moves.presentation;

import com.cellarmate.backend.modules.moves.application.MovePlanService;
import com.cellarmate.backend.modules.moves.domain.MovePlanValidation;
import com.cellarmate.backend.modules.moves.presentation.dto.MoveAnalysisRequest;
import com.cellarmate.backend.modules.moves.presentation.dto.MoveAnalysisResponse;
import com.cellarmate.backend.modules.moves.presentation.dto.MoveSimulationRequest;
import com.cellarmate.backend.modules.moves.presentation.dto.MoveSimulationResponse;
import com.cellarmate.backend.modules.moves.presentation.dto.MoveValidationRequest;

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
@RequestMapping("/cellar/moves")
public class CellarMovesController {

    private final MovePlanService movePlanService;

    public CellarMovesController(MovePlanService movePlanService) {
        this.movePlanService = movePlanService;
    }

    @Operation(summary = "Analyze suggested moves", description = "Finds swap pairs and slot read/write dependencies.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Swap partners and dependency flag"),
            @ApiResponse(responseCode = "422", description = "Suggestion list failed validation")
    })
    @PostMapping("/analysis")
    public ResponseEntity<MoveAnalysisResponse> analyze(@Valid @RequestBody MoveAnalysisRequest request) {
        return ResponseEntity.ok(movePlanService.analyze(request));
    }

    @Operation(summary = "Validate a move plan", description = "Checks a plan against a snapshot of the cellar grid.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Validation result, valid or not"),
            @ApiResponse(responseCode = "400", description = "Duplicate slot in the snapshot")
    })
    @PostMapping("/validate")
    public ResponseEntity<MovePlanValidation> validate(@Valid @RequestBody MoveValidationRequest request) {
        return ResponseEntity.ok(movePlanService.validate(request));
    }

    @Operation(summary = "Simulate a move plan",
            description = "Applies the plan to a copy of the layout by clearing every source, then filling every target.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Projected layout"),
            @ApiResponse(responseCode = "422", description = "Plan failed validation")
    })
    @PostMapping("/simulate")
    public ResponseEntity<MoveSimulationResponse> simulate(@Valid @RequestBody MoveSimulationRequest request) {
        return ResponseEntity.ok(movePlanService.simulate(request));
    }
}
