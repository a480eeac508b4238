package com.unihousing.backend.global.error;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Failure envelope shared by the exception handler and the security entry points.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(boolean success, String message, String code, String requestId) {

    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(false, message, code, null);
    }

    public static ErrorResponse of(String code, String message, String requestId) {
        return new ErrorResponse(false, message, code, requestId);
    }
}
