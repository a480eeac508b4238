package com.unihousing.backend.modules.attendance.presentation;

import java.util.List;

import com.unihousing.backend.global.security.JwtAuthenticationPrincipal;
import com.unihousing.backend.global.web.ApiResponse;
import com.unihousing.backend.modules.attendance.application.AttendanceService;
import com.unihousing.backend.modules.attendance.presentation.dto.AttendanceLogResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Student")
@RestController
@RequestMapping("/student")
public class AttendanceController {

    private final AttendanceService attendanceService;

    public AttendanceController(AttendanceService attendanceService) {
        this.attendanceService = attendanceService;
    }

    @Operation(
            summary = "Attendance log",
            description = """
                    Newest day first. `date` (YYYY-MM-DD) selects one day and wins over `month` (YYYY-MM). \
                    A malformed value is answered with 400 `INVALID_DATE`.
                    """
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Log entries"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "`INVALID_DATE`")
    })
    @GetMapping("/attendance")
    public ResponseEntity<ApiResponse<List<AttendanceLogResponse>>> getAttendance(
            @Parameter(hidden = true) @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestParam(name = "month", required = false) String month,
            @RequestParam(name = "date", required = false) String date
    ) {
        return ResponseEntity.ok(ApiResponse.list(attendanceService.getAttendance(principal.id(), month, date)));
    }
}
