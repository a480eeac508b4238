package com.unihousing.backend.modules.maintenance.domain;

import com.unihousing.backend.global.validation.CodedEnum;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MaintenanceStatus implements CodedEnum {
    OPEN("open"),
    IN_PROGRESS("in_progress"),
    FIXED("fixed");

    private final String code;

    MaintenanceStatus(String code) {
        this.code = code;
    }

    @Override
    @JsonValue
    public String getCode() {
        return code;
    }
}
