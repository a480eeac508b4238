package com.unihousing.backend.modules.announcement.domain;

import com.unihousing.backend.global.jpa.AbstractCreatedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

/**
 * Published by staff; read-only for this service.
 */
@Entity
@Immutable
@Table(name = "announcements")
public class Announcement extends AbstractCreatedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "body", nullable = false)
    private String body;

    @Column(name = "category", nullable = false, length = 50)
    private String category;

    @Column(name = "priority", nullable = false, length = 20)
    private String priority;

    protected Announcement() {
    }

    public Announcement(String title, String body, String category, String priority) {
        this.title = title;
        this.body = body;
        this.category = category;
        this.priority = priority;
    }

    public Long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getBody() {
        return body;
    }

    public String getCategory() {
        return category;
    }

    public String getPriority() {
        return priority;
    }
}
