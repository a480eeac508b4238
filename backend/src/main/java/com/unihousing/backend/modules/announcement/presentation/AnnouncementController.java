package com.unihousing.backend.modules.announcement.presentation;

import java.util.List;

import com.unihousing.backend.global.web.ApiResponse;
import com.unihousing.backend.modules.announcement.application.AnnouncementService;
import com.unihousing.backend.modules.announcement.presentation.dto.AnnouncementResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Announcements")
@RestController
@RequestMapping("/announcements")
public class AnnouncementController {

    private final AnnouncementService announcementService;

    public AnnouncementController(AnnouncementService announcementService) {
        this.announcementService = announcementService;
    }

    @Operation(summary = "Announcements, newest first, optionally filtered by category")
    @GetMapping
    public ResponseEntity<ApiResponse<List<AnnouncementResponse>>> getAnnouncements(
            @RequestParam(name = "limit", required = false) String limit,
            @RequestParam(name = "category", required = false) String category
    ) {
        return ResponseEntity.ok(ApiResponse.list(announcementService.getAnnouncements(limit, category)));
    }
}
