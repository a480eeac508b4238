package com.unihousing.backend.modules.complaint.presentation;

import java.util.List;

import com.unihousing.backend.global.security.JwtAuthenticationPrincipal;
import com.unihousing.backend.global.web.ApiResponse;
import com.unihousing.backend.modules.complaint.application.ComplaintService;
import com.unihousing.backend.modules.complaint.presentation.dto.ComplaintResponse;
import com.unihousing.backend.modules.complaint.presentation.dto.CreateComplaintRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
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
@RequestMapping("/services/complaints")
public class ComplaintController {

    private final ComplaintService complaintService;

    public ComplaintController(ComplaintService complaintService) {
        this.complaintService = complaintService;
    }

    @Operation(summary = "Own complaints, newest first. Unknown filter values are ignored.")
    @GetMapping
    public ResponseEntity<ApiResponse<List<ComplaintResponse>>> getComplaints(
            @Parameter(hidden = true) @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "type", required = false) String type
    ) {
        return ResponseEntity.ok(ApiResponse.list(complaintService.getComplaints(principal.id(), status, type)));
    }

    @Operation(
            summary = "File a complaint",
            description = """
                    `title`, `description` and `type` (general | urgent) are required. \
                    `is_secret` defaults to false and `recipient` to Management.
                    """
    )
    @PostMapping
    public ResponseEntity<ApiResponse<ComplaintResponse>> createComplaint(
            @Parameter(hidden = true) @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestBody CreateComplaintRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.of("Complaint submitted successfully",
                        complaintService.createComplaint(principal.id(), request)));
    }
}
