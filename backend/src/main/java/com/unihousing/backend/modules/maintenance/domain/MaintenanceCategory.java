package com.unihousing.backend.modules.maintenance.domain;

import com.unihousing.backend.global.validation.CodedEnum;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MaintenanceCategory implements CodedEnum {
    PLUMBING("plumbing"),
    ELECTRIC("electric"),
    NET("net"),
    FURNITURE("furniture"),
    OTHER("other");

    private final String code;

    MaintenanceCategory(String code) {
        this.code = code;
    }

    @Override
    @JsonValue
    public String getCode() {
        return code;
    }
}
