package com.unihousing.backend.modules.permission.presentation;

import java.util.List;

import com.unihousing.backend.global.security.JwtAuthenticationPrincipal;
import com.unihousing.backend.global.web.ApiResponse;
import com.unihousing.backend.modules.permission.application.PermissionService;
import com.unihousing.backend.modules.permission.presentation.dto.CreatePermissionRequest;
import com.unihousing.backend.modules.permission.presentation.dto.PermissionRequestResponse;

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
@RequestMapping("/services/permissions")
public class PermissionController {

    private final PermissionService permissionService;

    public PermissionController(PermissionService permissionService) {
        this.permissionService = permissionService;
    }

    @Operation(summary = "Own permission requests ordered by start date")
    @GetMapping
    public ResponseEntity<ApiResponse<List<PermissionRequestResponse>>> getPermissions(
            @Parameter(hidden = true) @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "type", required = false) String type
    ) {
        return ResponseEntity.ok(ApiResponse.list(permissionService.getPermissions(principal.id(), status, type)));
    }

    @Operation(
            summary = "Request a late-return or travel permission",
            description = """
                    Dates are YYYY-MM-DD, both strictly after today (UTC) and `end_date` not before \
                    `start_date`.
                    """
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Created as pending"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "400",
                    description = "`MISSING_FIELD`, `INVALID_ENUM`, `INVALID_DATE`, `DATE_NOT_FUTURE` or `INVALID_DATE_RANGE`"
            )
    })
    @PostMapping
    public ResponseEntity<ApiResponse<PermissionRequestResponse>> createPermission(
            @Parameter(hidden = true) @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestBody CreatePermissionRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.of("Permission request submitted successfully",
                        permissionService.createPermission(principal.id(), request)));
    }
}
