package com.unihousing.backend.modules.clearance.presentation;

import com.unihousing.backend.global.security.JwtAuthenticationPrincipal;
import com.unihousing.backend.global.web.ApiResponse;
import com.unihousing.backend.modules.clearance.application.ClearanceService;
import com.unihousing.backend.modules.clearance.presentation.dto.ClearanceResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Student")
@RestController
@RequestMapping("/student/clearance")
public class ClearanceController {

    private final ClearanceService clearanceService;

    public ClearanceController(ClearanceService clearanceService) {
        this.clearanceService = clearanceService;
    }

    @Operation(summary = "Move-out clearance progress; `not_initiated` when no process exists")
    @GetMapping
    public ResponseEntity<ApiResponse<ClearanceResponse>> getClearance(
            @Parameter(hidden = true) @AuthenticationPrincipal JwtAuthenticationPrincipal principal
    ) {
        return ResponseEntity.ok(ApiResponse.of(clearanceService.getClearance(principal.id())));
    }

    @Operation(summary = "Start the move-out clearance process (409 when already started)")
    @PostMapping("/initiate")
    public ResponseEntity<ApiResponse<ClearanceResponse>> initiate(
            @Parameter(hidden = true) @AuthenticationPrincipal JwtAuthenticationPrincipal principal
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.of("Clearance process initiated", clearanceService.initiate(principal.id())));
    }
}
