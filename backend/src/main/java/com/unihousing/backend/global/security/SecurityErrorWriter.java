package com.unihousing.backend.global.security;

import java.io.IOException;

import com.unihousing.backend.global.error.ErrorResponse;
import com.unihousing.backend.global.web.RequestIdFilter;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * Writes the failure envelope from inside the security filter chain, where the
 * {@code @ControllerAdvice} is not reachable.
 */
@Component
public class SecurityErrorWriter {

    private final ObjectMapper objectMapper;

    public SecurityErrorWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(HttpServletResponse response, HttpStatus status, String code, String message) throws IOException {
        ErrorResponse body = ErrorResponse.of(code, message, MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
