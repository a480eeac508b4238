package com.unihousing.backend.modules.announcement.infrastructure.persistence;

/**
 * @param category case-insensitive category match, {@code null} for all
 * @param limit    maximum rows, {@code null} for all
 */
public record AnnouncementSearchCondition(String category, Integer limit) {
}
