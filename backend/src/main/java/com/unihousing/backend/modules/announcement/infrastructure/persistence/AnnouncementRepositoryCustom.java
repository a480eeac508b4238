package com.unihousing.backend.modules.announcement.infrastructure.persistence;

import java.util.List;

import com.unihousing.backend.modules.announcement.domain.Announcement;

public interface AnnouncementRepositoryCustom {

    List<Announcement> search(AnnouncementSearchCondition condition);
}
