package com.unihousing.backend.modules.maintenance.presentation;

import java.util.List;

import com.unihousing.backend.global.security.JwtAuthenticationPrincipal;
import com.unihousing.backend.global.web.ApiResponse;
import com.unihousing.backend.modules.maintenance.application.MaintenanceService;
import com.unihousing.backend.modules.maintenance.presentation.dto.CreateMaintenanceRequest;
import com.unihousing.backend.modules.maintenance.presentation.dto.MaintenanceRequestResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Services")
@RestController
@RequestMapping("/services/maintenance")
public class MaintenanceController {

    private final MaintenanceService maintenanceService;

    public MaintenanceController(MaintenanceService maintenanceService) {
        this.maintenanceService = maintenanceService;
    }

    @Operation(summary = "Maintenance requests for the caller's room, newest first")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Requests"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "`NOT_ASSIGNED_TO_ROOM`")
    })
    @GetMapping
    public ResponseEntity<ApiResponse<List<MaintenanceRequestResponse>>> getRequests(
            @Parameter(hidden = true) @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "category", required = false) String category
    ) {
        return ResponseEntity.ok(ApiResponse.list(maintenanceService.getRequests(principal.id(), status, category)));
    }

    @Operation(
            summary = "Open a maintenance request for the caller's room",
            description = "`category` is one of plumbing, electric, net, furniture, other."
    )
    @PostMapping
    public ResponseEntity<ApiResponse<MaintenanceRequestResponse>> createRequest(
            @Parameter(hidden = true) @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestBody CreateMaintenanceRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.of("Maintenance request submitted successfully",
                        maintenanceService.createRequest(principal.id(), request)));
    }
}
