package com.unihousing.backend.modules.activity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.unihousing.backend.modules.activity.domain.Activity;
import com.unihousing.backend.modules.activity.infrastructure.persistence.ActivitySubscriptionRepository;
import com.unihousing.backend.modules.student.domain.Student;
import com.unihousing.backend.support.AbstractPostgresIntegrationTest;
import com.unihousing.backend.support.TestDataFactory;

import org.junit.jupiter.api.DisplayName;
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
class ActivityIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TestDataFactory testData;

    @Autowired
    private ActivitySubscriptionRepository subscriptionRepository;

    @Test
    void upcomingListShowsCountsAndViewerFlag() throws Exception {
        Student viewer = testData.createStudent("Viewer", null);
        Student other = testData.createStudent("Other", null);
        Activity later = testData.createActivity("Movie Night", inDays(7), 30);
        Activity sooner = testData.createActivity("Football", inDays(2), 10);
        testData.createActivity("Yesterday's Quiz", inDays(-1), 10);
        testData.subscribe(viewer.getId(), later.getId());
        testData.subscribe(other.getId(), later.getId());
        testData.subscribe(other.getId(), sooner.getId());

        mockMvc.perform(get("/activities").header(HttpHeaders.AUTHORIZATION, testData.studentToken(viewer)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.data[*].title", contains("Football", "Movie Night")))
                .andExpect(jsonPath("$.data[0].participant_count").value(1))
                .andExpect(jsonPath("$.data[0].is_subscribed").value(false))
                .andExpect(jsonPath("$.data[1].participant_count").value(2))
                .andExpect(jsonPath("$.data[1].is_subscribed").value(true))
                .andExpect(jsonPath("$.data[1].max_participants").value(30));
    }

    @Test
    void positiveLimitTruncatesOtherValuesAreIgnored() throws Exception {
        Student viewer = testData.createStudent("Viewer", null);
        testData.createActivity("One", inDays(1), 5);
        testData.createActivity("Two", inDays(2), 5);
        testData.createActivity("Three", inDays(3), 5);
        String token = testData.studentToken(viewer);

        mockMvc.perform(get("/activities").param("limit", "2").header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(jsonPath("$.data[*].title", contains("One", "Two")));
        mockMvc.perform(get("/activities").param("limit", "0").header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(jsonPath("$.count").value(3));
        mockMvc.perform(get("/activities").param("limit", "many").header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(jsonPath("$.count").value(3));
    }

    @Test
    void subscribeAndUnsubscribe() throws Exception {
        Student student = testData.createStudent("Joiner", null);
        Activity activity = testData.createActivity("Chess Club", inDays(4), 5);

        subscribe(student, activity.getId())
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Successfully subscribed to \"Chess Club\""))
                .andExpect(jsonPath("$.data.activity_id").value(activity.getId()))
                .andExpect(jsonPath("$.data.student_id").value(student.getId()));

        subscribe(student, activity.getId())
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ALREADY_SUBSCRIBED"));

        mockMvc.perform(post("/activities/unsubscribe")
                        .header(HttpHeaders.AUTHORIZATION, testData.studentToken(student))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"activity_id\": %d}".formatted(activity.getId())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Successfully unsubscribed from \"Chess Club\""));

        assertThat(subscriptionRepository.existsByStudentIdAndActivityId(student.getId(), activity.getId())).isFalse();

        mockMvc.perform(post("/activities/unsubscribe")
                        .header(HttpHeaders.AUTHORIZATION, testData.studentToken(student))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"activity_id\": %d}".formatted(activity.getId())))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SUBSCRIPTION_NOT_FOUND"));
    }

    @Test
    void fullActivityRejectsNewcomers() throws Exception {
        Activity activity = testData.createActivity("Tiny Workshop", inDays(3), 1);
        Student first = testData.createStudent("First", null);
        Student second = testData.createStudent("Second", null);

        subscribe(first, activity.getId()).andExpect(status().isCreated());
        subscribe(second, activity.getId())
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("ACTIVITY_FULL"))
                .andExpect(jsonPath("$.message").value("Activity is full (1/1)"));
    }

    @Test
    void unknownActivityAndMissingIdAreRejected() throws Exception {
        Student student = testData.createStudent("Joiner", null);

        subscribe(student, 424242L)
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ACTIVITY_NOT_FOUND"));

        mockMvc.perform(post("/activities/subscribe")
                        .header(HttpHeaders.AUTHORIZATION, testData.studentToken(student))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("activity_id is required"));
    }

    @Test
    @DisplayName("concurrent subscriptions never exceed capacity")
    void concurrentSubscriptionsRespectCapacity() throws Exception {
        int capacity = 3;
        int contenders = 8;
        Activity activity = testData.createActivity("Popular Trip", inDays(5), capacity);
        List<String> tokens = new ArrayList<>();
        for (int i = 0; i < contenders; i++) {
            tokens.add(testData.studentToken(testData.createStudent("Contender " + i, null)));
        }

        ExecutorService executor = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> results = new ArrayList<>();
        try {
            for (String token : tokens) {
                Callable<Integer> task = () -> {
                    start.await();
                    return mockMvc.perform(post("/activities/subscribe")
                                    .header(HttpHeaders.AUTHORIZATION, token)
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content("{\"activity_id\": %d}".formatted(activity.getId())))
                            .andReturn()
                            .getResponse()
                            .getStatus();
                };
                results.add(executor.submit(task));
            }
            start.countDown();

            int created = 0;
            int full = 0;
            for (Future<Integer> result : results) {
                int statusCode = result.get(30, TimeUnit.SECONDS);
                if (statusCode == 201) {
                    created++;
                } else if (statusCode == 400) {
                    full++;
                }
            }
            assertThat(created).isEqualTo(capacity);
            assertThat(full).isEqualTo(contenders - capacity);
        } finally {
            executor.shutdownNow();
        }

        assertThat(subscriptionRepository.countByActivityId(activity.getId())).isEqualTo(capacity);
    }

    @Test
    @DisplayName("concurrent duplicates for one student yield one 201 and conflicts for the rest")
    void concurrentDuplicatesYieldSingleSubscription() throws Exception {
        int attempts = 6;
        Activity activity = testData.createActivity("Book Club", inDays(5), 20);
        String token = testData.studentToken(testData.createStudent("Eager", null));

        ExecutorService executor = Executors.newFixedThreadPool(attempts);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> results = new ArrayList<>();
        try {
            for (int i = 0; i < attempts; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return mockMvc.perform(post("/activities/subscribe")
                                    .header(HttpHeaders.AUTHORIZATION, token)
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content("{\"activity_id\": %d}".formatted(activity.getId())))
                            .andReturn()
                            .getResponse()
                            .getStatus();
                }));
            }
            start.countDown();

            List<Integer> statuses = new ArrayList<>();
            for (Future<Integer> result : results) {
                statuses.add(result.get(30, TimeUnit.SECONDS));
            }
            assertThat(statuses).containsOnly(201, 409);
            assertThat(statuses).filteredOn(code -> code == 201).hasSize(1);
        } finally {
            executor.shutdownNow();
        }

        assertThat(subscriptionRepository.countByActivityId(activity.getId())).isEqualTo(1);
    }

    private ResultActions subscribe(Student student, Long activityId) throws Exception {
        return mockMvc.perform(post("/activities/subscribe")
                .header(HttpHeaders.AUTHORIZATION, testData.studentToken(student))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"activity_id\": %d}".formatted(activityId)));
    }

    private static OffsetDateTime inDays(int days) {
        return OffsetDateTime.now(ZoneOffset.UTC).plusDays(days);
    }
}
