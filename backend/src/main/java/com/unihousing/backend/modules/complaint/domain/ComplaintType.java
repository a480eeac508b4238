package com.unihousing.backend.modules.complaint.domain;

import com.unihousing.backend.global.validation.CodedEnum;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ComplaintType implements CodedEnum {
    GENERAL("general"),
    URGENT("urgent");

    private final String code;

    ComplaintType(String code) {
        this.code = code;
    }

    @Override
    @JsonValue
    public String getCode() {
        return code;
    }
}
