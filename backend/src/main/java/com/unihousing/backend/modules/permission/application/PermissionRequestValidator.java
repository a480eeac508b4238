package com.unihousing.backend.modules.permission.application;

import java.time.LocalDate;
import java.util.Map;

import com.unihousing.backend.global.error.ProblemException;
import com.unihousing.backend.global.validation.RequestValidation;
import com.unihousing.backend.modules.permission.domain.PermissionType;
import com.unihousing.backend.modules.permission.presentation.dto.CreatePermissionRequest;

/**
 * Checks run in order: presence, type, date format, then the calendar rules against
 * {@code today}. Both dates must fall strictly after today and the range may not run backwards.
 */
public final class PermissionRequestValidator {

    public static final String DATE_NOT_FUTURE = "DATE_NOT_FUTURE";
    public static final String INVALID_DATE_RANGE = "INVALID_DATE_RANGE";

    private PermissionRequestValidator() {
    }

    public static NewPermissionRequest validate(CreatePermissionRequest request, LocalDate today) {
        Map<String, Object> required = RequestValidation.fields();
        required.put("type", request.type());
        required.put("start_date", request.startDate());
        required.put("end_date", request.endDate());
        required.put("reason", request.reason());
        RequestValidation.requireFields(required);

        PermissionType type = RequestValidation.parseEnum(PermissionType.class, "type", request.type());
        LocalDate startDate = RequestValidation.parseDate("start_date", request.startDate());
        LocalDate endDate = RequestValidation.parseDate("end_date", request.endDate());
        String reason = request.reason().trim();
        RequestValidation.requireMaxLength("reason", reason, RequestValidation.DESCRIPTION_MAX_LENGTH);

        if (!startDate.isAfter(today)) {
            throw ProblemException.badRequest(DATE_NOT_FUTURE, "start_date must be in the future");
        }
        if (endDate.isBefore(startDate)) {
            throw ProblemException.badRequest(INVALID_DATE_RANGE, "end_date must be on or after start_date");
        }
        return new NewPermissionRequest(type, startDate, endDate, reason);
    }
}
