package com.unihousing.backend.modules.permission;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.LocalDate;
import java.time.ZoneOffset;

import com.unihousing.backend.modules.permission.infrastructure.persistence.PermissionRequestRepository;
import com.unihousing.backend.modules.student.domain.Student;
import com.unihousing.backend.support.AbstractPostgresIntegrationTest;
import com.unihousing.backend.support.TestDataFactory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
class PermissionIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TestDataFactory testData;

    @Autowired
    private PermissionRequestRepository permissionRequestRepository;

    @Test
    void futureRequestIsAccepted() throws Exception {
        Student student = testData.createStudent("Traveller", null);
        LocalDate start = today().plusDays(3);
        LocalDate end = today().plusDays(5);

        submit(student, "travel", start.toString(), end.toString(), "Visiting family")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Permission request submitted successfully"))
                .andExpect(jsonPath("$.data.type").value("travel"))
                .andExpect(jsonPath("$.data.status").value("pending"))
                .andExpect(jsonPath("$.data.start_date").value(start.toString()))
                .andExpect(jsonPath("$.data.end_date").value(end.toString()));

        assertThat(permissionRequestRepository.countByStudentId(student.getId())).isEqualTo(1);
    }

    @Test
    void todayIsNotInTheFuture() throws Exception {
        Student student = testData.createStudent("Traveller", null);
        String today = today().toString();

        submit(student, "late", today, today, "Late lab")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("DATE_NOT_FUTURE"));

        assertThat(permissionRequestRepository.countByStudentId(student.getId())).isZero();
    }

    @Test
    void backwardsRangeIsRejected() throws Exception {
        Student student = testData.createStudent("Traveller", null);

        submit(student, "travel", today().plusDays(5).toString(), today().plusDays(2).toString(), "Trip")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_DATE_RANGE"));

        assertThat(permissionRequestRepository.countByStudentId(student.getId())).isZero();
    }

    @Test
    void listIsOrderedByStartDate() throws Exception {
        Student student = testData.createStudent("Traveller", null);
        submit(student, "travel", today().plusDays(10).toString(), today().plusDays(12).toString(), "Second")
                .andExpect(status().isCreated());
        submit(student, "late", today().plusDays(1).toString(), today().plusDays(1).toString(), "First")
                .andExpect(status().isCreated());

        mockMvc.perform(get("/services/permissions").header(HttpHeaders.AUTHORIZATION, testData.studentToken(student)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.data[*].reason", contains("First", "Second")));

        mockMvc.perform(get("/services/permissions")
                        .param("type", "travel")
                        .header(HttpHeaders.AUTHORIZATION, testData.studentToken(student)))
                .andExpect(jsonPath("$.data[*].reason", contains("Second")));
    }

    private ResultActions submit(Student student, String type, String start, String end, String reason)
            throws Exception {
        return mockMvc.perform(post("/services/permissions")
                .header(HttpHeaders.AUTHORIZATION, testData.studentToken(student))
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"type": "%s", "start_date": "%s", "end_date": "%s", "reason": "%s"}
                        """.formatted(type, start, end, reason)));
    }

    private static LocalDate today() {
        return LocalDate.now(ZoneOffset.UTC);
    }
}
