package com.unihousing.backend.modules.activity.presentation;

import java.util.List;

import com.unihousing.backend.global.security.JwtAuthenticationPrincipal;
import com.unihousing.backend.global.web.ApiResponse;
import com.unihousing.backend.modules.activity.application.ActivityService;
import com.unihousing.backend.modules.activity.application.ActivityService.SubscriptionResult;
import com.unihousing.backend.modules.activity.presentation.dto.ActivityResponse;
import com.unihousing.backend.modules.activity.presentation.dto.SubscriptionRequest;
import com.unihousing.backend.modules.activity.presentation.dto.SubscriptionResponse;

import jakarta.validation.Valid;

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

@Tag(name = "Activities")
@RestController
@RequestMapping("/activities")
public class ActivityController {

    private final ActivityService activityService;

    public ActivityController(ActivityService activityService) {
        this.activityService = activityService;
    }

    @Operation(
            summary = "Upcoming activities",
            description = "Soonest first. A positive `limit` truncates the list; anything else returns every row."
    )
    @GetMapping
    public ResponseEntity<ApiResponse<List<ActivityResponse>>> getActivities(
            @Parameter(hidden = true) @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestParam(name = "limit", required = false) String limit
    ) {
        return ResponseEntity.ok(ApiResponse.list(activityService.getUpcomingActivities(principal.id(), limit)));
    }

    @Operation(summary = "Subscribe to an activity")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Subscribed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "`ACTIVITY_FULL`"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "`ACTIVITY_NOT_FOUND`"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "`ALREADY_SUBSCRIBED`")
    })
    @PostMapping("/subscribe")
    public ResponseEntity<ApiResponse<SubscriptionResponse>> subscribe(
            @Parameter(hidden = true) @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody SubscriptionRequest request
    ) {
        SubscriptionResult result = activityService.subscribe(principal.id(), request.activityId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.of("Successfully subscribed to \"" + result.activityTitle() + "\"",
                        result.subscription()));
    }

    @Operation(summary = "Cancel a subscription")
    @PostMapping("/unsubscribe")
    public ResponseEntity<ApiResponse<Void>> unsubscribe(
            @Parameter(hidden = true) @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody SubscriptionRequest request
    ) {
        String title = activityService.unsubscribe(principal.id(), request.activityId());
        return ResponseEntity.ok(ApiResponse.of("Successfully unsubscribed from \"" + title + "\"", null));
    }
}
