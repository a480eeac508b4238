package com.unihousing.backend.modules.student.presentation;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.OffsetDateTime;

import com.unihousing.backend.global.common.time.TimeConfig;
import com.unihousing.backend.global.error.ProblemException;
import com.unihousing.backend.global.security.RestAccessDeniedHandler;
import com.unihousing.backend.global.security.RestAuthenticationEntryPoint;
import com.unihousing.backend.global.security.SecurityConfig;
import com.unihousing.backend.global.security.SecurityErrorWriter;
import com.unihousing.backend.modules.auth.application.JwtTokenService;
import com.unihousing.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.unihousing.backend.modules.student.application.StudentProfileService;
import com.unihousing.backend.modules.student.application.StudentSupport;
import com.unihousing.backend.modules.student.presentation.dto.RoomResponse;
import com.unihousing.backend.modules.student.presentation.dto.StudentProfileResponse;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = StudentProfileController.class)
@Import({
        SecurityConfig.class,
        RestAuthenticationEntryPoint.class,
        RestAccessDeniedHandler.class,
        SecurityErrorWriter.class,
        JwtTokenService.class,
        JwtTokenProvider.class,
        TimeConfig.class
})
class StudentProfileControllerTest {

    private static final String UNAUTHORIZED_MESSAGE = "Authentication required: provide a valid bearer token";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtTokenService jwtTokenService;

    @MockBean
    private StudentProfileService studentProfileService;

    @Test
    void missingTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/student/profile"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.message").value(UNAUTHORIZED_MESSAGE));
    }

    @Test
    @DisplayName("a forged token gets exactly the same 401 as no token")
    void invalidTokenLooksLikeMissingToken() throws Exception {
        mockMvc.perform(get("/student/profile").header(HttpHeaders.AUTHORIZATION, "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.message").value(UNAUTHORIZED_MESSAGE));
    }

    @Test
    void nonStudentRoleIsForbidden() throws Exception {
        String token = jwtTokenService.issueAccessToken(1L, "manager").token();

        mockMvc.perform(get("/student/profile").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    @Test
    void studentReceivesProfileInSnakeCase() throws Exception {
        OffsetDateTime created = OffsetDateTime.parse("2024-09-01T10:00:00Z");
        when(studentProfileService.getProfile(7L)).thenReturn(new StudentProfileResponse(
                7L, "29801011234567", "Omar Hassan", "20210042", "Engineering", 3, null, "standard", false,
                new RoomResponse(3L, "B-204", "Building B", 2, 2), created, created));
        String token = jwtTokenService.issueAccessToken(7L, "student").token();

        mockMvc.perform(get("/student/profile")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                        .header("X-Request-Id", "trace-123"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "trace-123"))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.full_name").value("Omar Hassan"))
                .andExpect(jsonPath("$.data.is_suspended").value(false))
                .andExpect(jsonPath("$.data.room.room_number").value("B-204"));
    }

    @Test
    void unknownStudentIsNotFound() throws Exception {
        when(studentProfileService.getProfile(8L))
                .thenThrow(ProblemException.notFound(StudentSupport.STUDENT_NOT_FOUND, "Student not found"));
        String token = jwtTokenService.issueAccessToken(8L, "student").token();

        mockMvc.perform(get("/student/profile").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value(StudentSupport.STUDENT_NOT_FOUND))
                .andExpect(jsonPath("$.message").value("Student not found"));
    }
}
