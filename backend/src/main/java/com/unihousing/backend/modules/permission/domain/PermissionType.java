package com.unihousing.backend.modules.permission.domain;

import com.unihousing.backend.global.validation.CodedEnum;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PermissionType implements CodedEnum {
    LATE("late"),
    TRAVEL("travel");

    private final String code;

    PermissionType(String code) {
        this.code = code;
    }

    @Override
    @JsonValue
    public String getCode() {
        return code;
    }
}
