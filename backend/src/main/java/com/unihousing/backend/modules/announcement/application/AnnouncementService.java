package com.unihousing.backend.modules.announcement.application;

import java.util.List;

import com.unihousing.backend.global.validation.RequestValidation;
import com.unihousing.backend.modules.announcement.infrastructure.persistence.AnnouncementRepository;
import com.unihousing.backend.modules.announcement.infrastructure.persistence.AnnouncementSearchCondition;
import com.unihousing.backend.modules.announcement.presentation.dto.AnnouncementResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AnnouncementService {

    private final AnnouncementRepository announcementRepository;

    public AnnouncementService(AnnouncementRepository announcementRepository) {
        this.announcementRepository = announcementRepository;
    }

    @Transactional(readOnly = true)
    public List<AnnouncementResponse> getAnnouncements(String rawLimit, String category) {
        AnnouncementSearchCondition condition = new AnnouncementSearchCondition(
                category,
                RequestValidation.parseLimit(rawLimit)
        );
        return announcementRepository.search(condition).stream()
                .map(AnnouncementResponse::from)
                .toList();
    }
}
