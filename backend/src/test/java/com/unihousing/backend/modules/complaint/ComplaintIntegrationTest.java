package com.unihousing.backend.modules.complaint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.unihousing.backend.modules.complaint.infrastructure.persistence.ComplaintRepository;
import com.unihousing.backend.modules.student.domain.Student;
import com.unihousing.backend.support.AbstractPostgresIntegrationTest;
import com.unihousing.backend.support.TestDataFactory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class ComplaintIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TestDataFactory testData;

    @Autowired
    private ComplaintRepository complaintRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    void createAppliesDefaults() throws Exception {
        Student student = testData.createStudent("Complainer", null);

        mockMvc.perform(post("/services/complaints")
                        .header(HttpHeaders.AUTHORIZATION, testData.studentToken(student))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title": " Noise ", "description": "Loud music after midnight", "type": "General"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Complaint submitted successfully"))
                .andExpect(jsonPath("$.data.title").value("Noise"))
                .andExpect(jsonPath("$.data.type").value("general"))
                .andExpect(jsonPath("$.data.status").value("pending"))
                .andExpect(jsonPath("$.data.is_secret").value(false))
                .andExpect(jsonPath("$.data.recipient").value("Management"))
                .andExpect(jsonPath("$.data.admin_reply").isEmpty())
                .andExpect(jsonPath("$.data.student_id").value(student.getId()));

        assertThat(complaintRepository.countByStudentId(student.getId())).isEqualTo(1);
    }

    @Test
    void invalidComplaintIsNotStored() throws Exception {
        Student student = testData.createStudent("Complainer", null);

        mockMvc.perform(post("/services/complaints")
                        .header(HttpHeaders.AUTHORIZATION, testData.studentToken(student))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title": "Noise", "description": "Loud", "type": "critical"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("INVALID_ENUM"))
                .andExpect(jsonPath("$.request_id").isNotEmpty());

        mockMvc.perform(post("/services/complaints")
                        .header(HttpHeaders.AUTHORIZATION, testData.studentToken(student))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MISSING_FIELD"))
                .andExpect(jsonPath("$.message").value("title, description, type are required"));

        assertThat(complaintRepository.countByStudentId(student.getId())).isZero();
    }

    @Test
    void malformedJsonIsValidationError() throws Exception {
        Student student = testData.createStudent("Complainer", null);

        mockMvc.perform(post("/services/complaints")
                        .header(HttpHeaders.AUTHORIZATION, testData.studentToken(student))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void listIsOwnNewestFirstWithLenientFilters() throws Exception {
        Student student = testData.createStudent("Complainer", null);
        Student other = testData.createStudent("Other", null);
        insertComplaint(student.getId(), "Old", "GENERAL", "RESOLVED", "2025-01-01T10:00:00Z");
        insertComplaint(student.getId(), "New", "URGENT", "PENDING", "2025-01-05T10:00:00Z");
        insertComplaint(other.getId(), "Not mine", "URGENT", "PENDING", "2025-01-06T10:00:00Z");
        String token = testData.studentToken(student);

        mockMvc.perform(get("/services/complaints").header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.data[*].title", contains("New", "Old")));

        mockMvc.perform(get("/services/complaints")
                        .param("status", "Resolved")
                        .header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(jsonPath("$.data[*].title", contains("Old")));

        mockMvc.perform(get("/services/complaints")
                        .param("status", "archived")
                        .param("type", "urgent")
                        .header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(jsonPath("$.data[*].title", contains("New")));
    }

    @Test
    void staffTokenIsForbidden() throws Exception {
        mockMvc.perform(get("/services/complaints").header(HttpHeaders.AUTHORIZATION, testData.staffToken(1L, "supervisor")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    private void insertComplaint(Long studentId, String title, String type, String status, String createdAt) {
        jdbcTemplate.update("""
                INSERT INTO complaints (student_id, title, description, type, status, created_at, updated_at)
                VALUES (?, ?, 'details', ?, ?, CAST(? AS TIMESTAMPTZ), CAST(? AS TIMESTAMPTZ))
                """, studentId, title, type, status, createdAt, createdAt);
    }
}
