package com.unihousing.backend.modules.complaint.application;

import com.unihousing.backend.modules.complaint.domain.ComplaintType;

/**
 * Validated complaint input with defaults applied.
 */
public record NewComplaint(String title, String description, ComplaintType type, boolean secret, String recipient) {
}
