package com.unihousing.backend.modules.announcement.infrastructure.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import com.unihousing.backend.modules.announcement.domain.Announcement;

public interface AnnouncementRepository extends JpaRepository<Announcement, Long>, AnnouncementRepositoryCustom {
}
