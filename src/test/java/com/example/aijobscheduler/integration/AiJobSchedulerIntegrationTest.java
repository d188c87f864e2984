package com.example.aijobscheduler.integration;

import com.example.aijobscheduler.client.GenerationClient;
import com.example.aijobscheduler.cron.CronExpressionEvaluator;
import com.example.aijobscheduler.domain.enums.RunStatus;
import com.example.aijobscheduler.domain.repository.JobRepository;
import com.example.aijobscheduler.domain.repository.JobRunRepository;
import com.example.aijobscheduler.dto.CreateJobRequest;
import com.example.aijobscheduler.dto.CronParseRequest;
import com.example.aijobscheduler.dto.UpdateJobRequest;
import com.example.aijobscheduler.exception.GenerationUnavailableException;
import com.example.aijobscheduler.service.scheduler.JobScheduler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.MOCK,
        properties = {
                "spring.main.web-application-type=servlet",
                "ai-jobs.scheduler.auto-start=true",
                "pushover.enabled=false",
                "slack.enabled=false"
        }
)
@AutoConfigureMockMvc
@DisplayName("AI Job Scheduler Integration Tests")
class AiJobSchedulerIntegrationTest {

    // Only fires on New Year's Day, so nothing triggers during the test run
    private static final String YEARLY = "0 0 1 1 *";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JobRepository jobRepository;

    @Autowired
    private JobRunRepository jobRunRepository;

    @Autowired
    private JobScheduler jobScheduler;

    @Autowired
    private CronExpressionEvaluator cronEvaluator;

    @MockBean
    private GenerationClient generationClient;

    @BeforeEach
    void setUp() {
        jobRunRepository.deleteAll();
        jobRepository.deleteAll();
    }

    private CreateJobRequest.CreateJobRequestBuilder jobRequest(String name) {
        return CreateJobRequest.builder()
                .name(name)
                .promptContent("Summarize the most important AI news of the day")
                .cronExpression(YEARLY)
                .recipients(List.of("team@example.com"));
    }

    private UUID createJob(CreateJobRequest request) throws Exception {
        var result = mockMvc.perform(post("/api/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andReturn();

        var body = objectMapper.readTree(result.getResponse().getContentAsString());
        return UUID.fromString(body.path("data").path("id").asText());
    }

    @Nested
    @DisplayName("Job API")
    class JobApiTests {

        @Test
        @DisplayName("Should create a job and arm it")
        void shouldCreateJob() throws Exception {
            // When
            mockMvc.perform(post("/api/jobs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(jobRequest("Daily AI News!").build())))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.message").value("Job created successfully"))
                    .andExpect(jsonPath("$.data.name").value("Daily AI News!"))
                    .andExpect(jsonPath("$.data.slug").value("daily-ai-news"))
                    .andExpect(jsonPath("$.data.cronExpression").value(YEARLY))
                    .andExpect(jsonPath("$.data.enabled").value(true))
                    .andExpect(jsonPath("$.data.running").value(false))
                    .andExpect(jsonPath("$.data.recipients[0]").value("team@example.com"))
                    .andExpect(jsonPath("$.data.nextRunAt").exists());

            // Then
            var saved = jobRepository.findAll();
            assertThat(saved).hasSize(1);
            assertThat(jobScheduler.isArmed(saved.get(0).getId())).isTrue();
        }

        @Test
        @DisplayName("Should return the job by id")
        void shouldGetJob() throws Exception {
            var jobId = createJob(jobRequest("Weekly report").build());

            mockMvc.perform(get("/api/jobs/{jobId}", jobId))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.id").value(jobId.toString()))
                    .andExpect(jsonPath("$.data.slug").value("weekly-report"));
        }

        @Test
        @DisplayName("Stored cron expression should keep its schedule")
        void storedCronShouldKeepSchedule() throws Exception {
            // Given
            var cron = "*/20 8-18 * * 1-5";
            var from = ZonedDateTime.of(2024, 1, 15, 10, 0, 0, 0, ZoneOffset.UTC);
            var before = cronEvaluator.nextFireTimes(cron, from, 10);

            // When
            var jobId = createJob(jobRequest("Office hours").cronExpression(cron).build());
            var result = mockMvc.perform(get("/api/jobs/{jobId}", jobId))
                    .andExpect(status().isOk())
                    .andReturn();

            // Then
            var stored = objectMapper.readTree(result.getResponse().getContentAsString())
                    .path("data").path("cronExpression").asText();
            assertThat(cronEvaluator.nextFireTimes(stored, from, 10)).isEqualTo(before);
        }

        @Test
        @DisplayName("Should list jobs")
        void shouldListJobs() throws Exception {
            createJob(jobRequest("First job").build());
            createJob(jobRequest("Second job").build());

            mockMvc.perform(get("/api/jobs"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data", hasSize(2)));
        }

        @Test
        @DisplayName("Should reject an invalid cron expression")
        void shouldRejectInvalidCron() throws Exception {
            mockMvc.perform(post("/api/jobs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(jobRequest("Bad cron").cronExpression("0 9 * *").build())))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.message").value(containsString("expected 5 fields")));

            assertThat(jobRepository.count()).isZero();
        }

        @Test
        @DisplayName("Should reject missing required fields")
        void shouldRejectMissingFields() throws Exception {
            mockMvc.perform(post("/api/jobs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\": \"ab\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Validation failed"))
                    .andExpect(jsonPath("$.errors").isArray());
        }

        @Test
        @DisplayName("Should reject a duplicate name")
        void shouldRejectDuplicate() throws Exception {
            createJob(jobRequest("Daily digest").build());

            mockMvc.perform(post("/api/jobs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(jobRequest("Daily digest").build())))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.success").value(false));
        }

        @Test
        @DisplayName("Disabling a job should disarm it")
        void disablingShouldDisarm() throws Exception {
            // Given
            var jobId = createJob(jobRequest("Daily digest").build());
            assertThat(jobScheduler.isArmed(jobId)).isTrue();

            // When
            mockMvc.perform(put("/api/jobs/{jobId}", jobId)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(UpdateJobRequest.builder().enabled(false).build())))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.enabled").value(false));

            // Then
            assertThat(jobScheduler.isArmed(jobId)).isFalse();
        }

        @Test
        @DisplayName("Should delete a job and disarm it")
        void shouldDeleteJob() throws Exception {
            // Given
            var jobId = createJob(jobRequest("Daily digest").build());

            // When
            mockMvc.perform(delete("/api/jobs/{jobId}", jobId))
                    .andExpect(status().isNoContent());

            // Then
            assertThat(jobRepository.existsById(jobId)).isFalse();
            assertThat(jobScheduler.isArmed(jobId)).isFalse();
            mockMvc.perform(get("/api/jobs/{jobId}", jobId))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Should return 404 for an unknown job")
        void shouldReturnNotFound() throws Exception {
            mockMvc.perform(get("/api/jobs/{jobId}", UUID.randomUUID()))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.success").value(false));
        }

        @Test
        @DisplayName("Should return 400 for a malformed id")
        void shouldRejectMalformedId() throws Exception {
            mockMvc.perform(get("/api/jobs/{jobId}", "not-a-uuid"))
                    .andExpect(status().isBadRequest());
        }
    }

    @Nested
    @DisplayName("Manual runs")
    class ManualRunTests {

        @Test
        @DisplayName("Should run a job to success and record its output")
        void shouldRunJobToSuccess() throws Exception {
            // Given
            given(generationClient.generate(anyString())).willReturn("# Digest\n\n| Item | Score |\n|---|---|\n| A | 1 |");
            var jobId = createJob(jobRequest("Daily digest").build());

            // When
            var result = mockMvc.perform(post("/api/jobs/{jobId}/run", jobId).param("wait", "true"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.message").value("Job run finished"))
                    .andExpect(jsonPath("$.data.status").value("success"))
                    .andExpect(jsonPath("$.data.jobName").value("Daily digest"))
                    .andExpect(jsonPath("$.data.outputContent").value(containsString("# Digest")))
                    .andExpect(jsonPath("$.data.htmlOutputContent").value(containsString("<table")))
                    .andExpect(jsonPath("$.data.completedAt").exists())
                    .andReturn();

            // Then
            var runId = UUID.fromString(objectMapper.readTree(result.getResponse().getContentAsString())
                    .path("data").path("id").asText());
            var run = jobRunRepository.findById(runId).orElseThrow();
            assertThat(run.getStatus()).isEqualTo(RunStatus.SUCCESS);
            assertThat(run.getDurationMs()).isNotNull();

            mockMvc.perform(get("/api/job-runs"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data", hasSize(1)))
                    .andExpect(jsonPath("$.data[0].id").value(runId.toString()));

            mockMvc.perform(get("/api/job-runs/{runId}", runId))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.status").value("success"));
        }

        @Test
        @DisplayName("Should record a failed generation")
        void shouldRecordFailedGeneration() throws Exception {
            // Given
            given(generationClient.generate(anyString()))
                    .willThrow(new GenerationUnavailableException("OpenAI API returned HTTP 503: overloaded"));
            var jobId = createJob(jobRequest("Daily digest").build());

            // When / Then
            mockMvc.perform(post("/api/jobs/{jobId}/run", jobId).param("wait", "true"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.status").value("failed"))
                    .andExpect(jsonPath("$.data.errorMessage").value(containsString("Worker exited with code 1")))
                    .andExpect(jsonPath("$.data.errorMessage").value(containsString("HTTP 503")));
        }

        @Test
        @DisplayName("Should return 404 when running an unknown job")
        void shouldRejectUnknownJobRun() throws Exception {
            mockMvc.perform(post("/api/jobs/{jobId}/run", UUID.randomUUID()))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Should reject an out-of-range run limit")
        void shouldRejectRunLimit() throws Exception {
            mockMvc.perform(get("/api/job-runs").param("limit", "0"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("Should return 404 for an unknown run")
        void shouldReturnNotFoundForRun() throws Exception {
            mockMvc.perform(get("/api/job-runs/{runId}", UUID.randomUUID()))
                    .andExpect(status().isNotFound());
        }
    }

    @Nested
    @DisplayName("Scheduler API")
    class SchedulerApiTests {

        @Test
        @DisplayName("Should report scheduler status")
        void shouldReportStatus() throws Exception {
            createJob(jobRequest("Enabled job").build());
            createJob(jobRequest("Disabled job").enabled(false).build());

            mockMvc.perform(get("/api/status"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.schedulerRunning").value(true))
                    .andExpect(jsonPath("$.data.activeJobsCount").value(1))
                    .andExpect(jsonPath("$.data.totalJobsCount").value(2));
        }

        @Test
        @DisplayName("Should describe a cron expression")
        void shouldParseCron() throws Exception {
            mockMvc.perform(post("/api/cron/parse")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(new CronParseRequest("30 14 * * 1-5"))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.cronExpression").value("30 14 * * 1-5"))
                    .andExpect(jsonPath("$.data.description").value("at minute 30, at 2:00 PM, from Monday to Friday"))
                    .andExpect(jsonPath("$.data.nextRuns", hasSize(5)));
        }

        @Test
        @DisplayName("Should reject an invalid cron expression to parse")
        void shouldRejectInvalidCronToParse() throws Exception {
            mockMvc.perform(post("/api/cron/parse")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(new CronParseRequest("61 * * * *"))))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false));
        }
    }
}
