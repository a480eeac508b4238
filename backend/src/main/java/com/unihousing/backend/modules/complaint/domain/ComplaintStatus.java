package com.unihousing.backend.modules.complaint.domain;

import com.unihousing.backend.global.validation.CodedEnum;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ComplaintStatus implements CodedEnum {
    PENDING("pending"),
    RESOLVED("resolved");

    private final String code;

    ComplaintStatus(String code) {
        this.code = code;
    }

    @Override
    @JsonValue
    public String getCode() {
        return code;
    }
}
