package com.unihousing.backend.modules.complaint.application;

import java.util.Map;

import com.unihousing.backend.global.validation.RequestValidation;
import com.unihousing.backend.modules.complaint.domain.Complaint;
import com.unihousing.backend.modules.complaint.domain.ComplaintType;
import com.unihousing.backend.modules.complaint.presentation.dto.CreateComplaintRequest;

public final class ComplaintRequestValidator {

    static final int RECIPIENT_MAX_LENGTH = 100;

    private ComplaintRequestValidator() {
    }

    public static NewComplaint validate(CreateComplaintRequest request) {
        Map<String, Object> required = RequestValidation.fields();
        required.put("title", request.title());
        required.put("description", request.description());
        required.put("type", request.type());
        RequestValidation.requireFields(required);

        String title = request.title().trim();
        String description = request.description().trim();
        RequestValidation.requireMaxLength("title", title, RequestValidation.TITLE_MAX_LENGTH);
        RequestValidation.requireMaxLength("description", description, RequestValidation.DESCRIPTION_MAX_LENGTH);
        ComplaintType type = RequestValidation.parseEnum(ComplaintType.class, "type", request.type());

        String recipient = request.recipient() == null || request.recipient().isBlank()
                ? Complaint.DEFAULT_RECIPIENT
                : request.recipient().trim();
        RequestValidation.requireMaxLength("recipient", recipient, RECIPIENT_MAX_LENGTH);

        return new NewComplaint(title, description, type, Boolean.TRUE.equals(request.isSecret()), recipient);
    }
}
