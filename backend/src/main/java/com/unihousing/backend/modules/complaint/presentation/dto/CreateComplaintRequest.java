package com.unihousing.backend.modules.complaint.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw body; every check happens in {@code ComplaintRequestValidator} so that the failure codes
 * stay specific.
 */
public record CreateComplaintRequest(
        String title,
        String description,
        String type,
        @JsonProperty("is_secret") Boolean isSecret,
        String recipient
) {
}
