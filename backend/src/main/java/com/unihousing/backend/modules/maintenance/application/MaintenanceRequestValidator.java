package com.unihousing.backend.modules.maintenance.application;

import java.util.Map;

import com.unihousing.backend.global.validation.RequestValidation;
import com.unihousing.backend.modules.maintenance.domain.MaintenanceCategory;
import com.unihousing.backend.modules.maintenance.presentation.dto.CreateMaintenanceRequest;

public final class MaintenanceRequestValidator {

    private MaintenanceRequestValidator() {
    }

    public static NewMaintenanceRequest validate(CreateMaintenanceRequest request) {
        Map<String, Object> required = RequestValidation.fields();
        required.put("category", request.category());
        required.put("description", request.description());
        RequestValidation.requireFields(required);

        MaintenanceCategory category = RequestValidation.parseEnum(MaintenanceCategory.class, "category", request.category());
        String description = request.description().trim();
        RequestValidation.requireMaxLength("description", description, RequestValidation.DESCRIPTION_MAX_LENGTH);
        return new NewMaintenanceRequest(category, description);
    }
}
