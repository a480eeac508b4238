package com.unihousing.backend.modules.attendance.domain;

import com.unihousing.backend.global.validation.CodedEnum;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AttendanceStatus implements CodedEnum {
    PRESENT("present"),
    ABSENT("absent");

    private final String code;

    AttendanceStatus(String code) {
        this.code = code;
    }

    @Override
    @JsonValue
    public String getCode() {
        return code;
    }
}
