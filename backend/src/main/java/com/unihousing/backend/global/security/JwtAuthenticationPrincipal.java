package com.unihousing.backend.global.security;

/**
 * Authenticated caller resolved from a bearer token. Every student-scoped query is keyed
 * on {@link #id()}.
 */
public record JwtAuthenticationPrincipal(Long id, String role) {

    public static final String STUDENT_ROLE = "student";
}
