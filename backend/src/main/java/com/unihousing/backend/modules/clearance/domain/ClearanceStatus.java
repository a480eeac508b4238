package com.unihousing.backend.modules.clearance.domain;

import com.unihousing.backend.global.validation.CodedEnum;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ClearanceStatus implements CodedEnum {
    NOT_INITIATED("not_initiated"),
    PENDING("pending"),
    COMPLETED("completed");

    private final String code;

    ClearanceStatus(String code) {
        this.code = code;
    }

    @Override
    @JsonValue
    public String getCode() {
        return code;
    }
}
