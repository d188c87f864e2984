package com.example.aijobscheduler.service;

import com.example.aijobscheduler.config.JobSchedulerProperties;
import com.example.aijobscheduler.cron.CronExpressionEvaluator;
import com.example.aijobscheduler.domain.entity.Job;
import com.example.aijobscheduler.domain.entity.JobRun;
import com.example.aijobscheduler.domain.repository.JobRepository;
import com.example.aijobscheduler.domain.repository.JobRunRepository;
import com.example.aijobscheduler.dto.CreateJobRequest;
import com.example.aijobscheduler.dto.JobResponse;
import com.example.aijobscheduler.dto.JobRunResponse;
import com.example.aijobscheduler.dto.UpdateJobRequest;
import com.example.aijobscheduler.exception.DuplicateJobException;
import com.example.aijobscheduler.exception.InvalidCronExpressionException;
import com.example.aijobscheduler.exception.JobNotFoundException;
import com.example.aijobscheduler.mapper.JobMapper;
import com.example.aijobscheduler.service.executor.JobExecutionDispatcher;
import com.example.aijobscheduler.service.scheduler.JobScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobManagementService Tests")
class JobManagementServiceTest {

    @Mock
    private JobRepository jobRepository;

    @Mock
    private JobRunRepository jobRunRepository;

    @Mock
    private JobRunService jobRunService;

    @Mock
    private JobScheduler jobScheduler;

    @Mock
    private JobExecutionDispatcher dispatcher;

    @Mock
    private JobMapper jobMapper;

    @Captor
    private ArgumentCaptor<Job> jobCaptor;

    private JobSchedulerProperties properties;
    private JobManagementService service;

    @BeforeEach
    void setUp() {
        properties = new JobSchedulerProperties();
        var evaluator = new CronExpressionEvaluator(Clock.fixed(Instant.parse("2024-01-15T10:00:00Z"), ZoneOffset.UTC));
        service = new JobManagementService(jobRepository, jobRunRepository, jobRunService, jobScheduler,
                dispatcher, evaluator, jobMapper, properties);
    }

    private void givenMapperEchoesJobs() {
        when(jobMapper.toResponse(any(Job.class))).thenAnswer(inv -> {
            Job job = inv.getArgument(0);
            return JobResponse.builder().id(job.getId()).name(job.getName()).slug(job.getSlug()).build();
        });
    }

    private Job existingJob() {
        return Job.builder()
                .id(UUID.randomUUID())
                .name("Daily digest")
                .slug("daily-digest")
                .promptContent("Summarize today's AI news")
                .cronExpression("0 9 * * *")
                .build();
    }

    private CreateJobRequest.CreateJobRequestBuilder createRequest() {
        return CreateJobRequest.builder()
                .name("Daily digest")
                .promptContent("Summarize today's AI news")
                .cronExpression("0 9 * * *");
    }

    @Nested
    @DisplayName("createJob Tests")
    class CreateJobTests {

        @Test
        @DisplayName("Should save, arm and report the next run")
        void shouldCreateJob() {
            // Given
            givenMapperEchoesJobs();
            when(jobRepository.save(any(Job.class))).thenAnswer(inv -> {
                Job job = inv.getArgument(0);
                job.setId(UUID.randomUUID());
                return job;
            });

            // When
            var response = service.createJob(createRequest()
                    .name("  Daily digest ")
                    .cronExpression(" 0   9 * * * ")
                    .build());

            // Then
            verify(jobRepository).save(jobCaptor.capture());
            var saved = jobCaptor.getValue();
            assertThat(saved.getName()).isEqualTo("Daily digest");
            assertThat(saved.getSlug()).isEqualTo("daily-digest");
            assertThat(saved.getCronExpression()).isEqualTo("0 9 * * *");
            assertThat(saved.isEnabled()).isTrue();

            verify(jobScheduler).addJob(saved);
            assertThat(response.isRunning()).isFalse();
            assertThat(response.getNextRunAt()).isEqualTo(ZonedDateTime.of(2024, 1, 16, 9, 0, 0, 0, ZoneOffset.UTC));
        }

        @Test
        @DisplayName("Should reject an invalid cron expression before saving")
        void shouldRejectInvalidCron() {
            assertThatThrownBy(() -> service.createJob(createRequest().cronExpression("0 9 * *").build()))
                    .isInstanceOf(InvalidCronExpressionException.class);

            verify(jobRepository, never()).save(any());
            verifyNoInteractions(jobScheduler);
        }

        @Test
        @DisplayName("Should reject a duplicate name")
        void shouldRejectDuplicateName() {
            when(jobRepository.existsByName("Daily digest")).thenReturn(true);

            assertThatThrownBy(() -> service.createJob(createRequest().build()))
                    .isInstanceOf(DuplicateJobException.class);

            verify(jobRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should reject a name that yields an empty slug")
        void shouldRejectEmptySlug() {
            assertThatThrownBy(() -> service.createJob(createRequest().name("!!!").build()))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should add the default recipient")
        void shouldAddDefaultRecipient() {
            // Given
            givenMapperEchoesJobs();
            properties.getNotifications().getEmail().setDefaultRecipient("ops@example.com");
            when(jobRepository.save(any(Job.class))).thenAnswer(inv -> inv.getArgument(0));

            // When
            service.createJob(createRequest().recipients(List.of("team@example.com", " ", "team@example.com")).build());

            // Then
            verify(jobRepository).save(jobCaptor.capture());
            assertThat(jobCaptor.getValue().getRecipients()).containsExactly("team@example.com", "ops@example.com");
        }

        @Test
        @DisplayName("Should not arm a disabled job")
        void shouldCreateDisabledJob() {
            // Given
            givenMapperEchoesJobs();
            when(jobRepository.save(any(Job.class))).thenAnswer(inv -> inv.getArgument(0));

            // When
            var response = service.createJob(createRequest().enabled(false).build());

            // Then
            assertThat(response.getNextRunAt()).isNull();
            verify(jobRepository).save(jobCaptor.capture());
            assertThat(jobCaptor.getValue().isEnabled()).isFalse();
        }
    }

    @Nested
    @DisplayName("updateJob and deleteJob Tests")
    class MutationTests {

        @Test
        @DisplayName("Renaming should regenerate the slug and re-arm")
        void renamingShouldRearm() {
            // Given
            givenMapperEchoesJobs();
            var job = existingJob();
            when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));
            when(jobRepository.saveAndFlush(job)).thenReturn(job);

            // When
            service.updateJob(job.getId(), UpdateJobRequest.builder()
                    .name("Weekly digest")
                    .cronExpression("0 9 * * 1")
                    .build());

            // Then
            assertThat(job.getSlug()).isEqualTo("weekly-digest");
            assertThat(job.getCronExpression()).isEqualTo("0 9 * * 1");
            verify(jobScheduler).updateJob(job);
        }

        @Test
        @DisplayName("Should reject a rename onto another job's name")
        void shouldRejectRenameCollision() {
            var job = existingJob();
            when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));
            when(jobRepository.existsByNameAndIdNot("Other job", job.getId())).thenReturn(true);

            assertThatThrownBy(() -> service.updateJob(job.getId(), UpdateJobRequest.builder().name("Other job").build()))
                    .isInstanceOf(DuplicateJobException.class);
            assertThat(job.getName()).isEqualTo("Daily digest");
            verifyNoInteractions(jobScheduler);
        }

        @Test
        @DisplayName("Should delete runs and job, then disarm")
        void shouldDeleteJob() {
            // Given
            var job = existingJob();
            when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));

            // When
            service.deleteJob(job.getId());

            // Then
            var order = inOrder(jobRunRepository, jobRepository, jobScheduler);
            order.verify(jobRunRepository).deleteByJobId(job.getId());
            order.verify(jobRepository).delete(job);
            order.verify(jobScheduler).removeJob(job.getId());
        }

        @Test
        @DisplayName("Should report an unknown job on delete")
        void shouldReportUnknownJob() {
            var jobId = UUID.randomUUID();
            when(jobRepository.findById(jobId)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.deleteJob(jobId))
                    .isInstanceOf(JobNotFoundException.class);
            verifyNoInteractions(jobScheduler, jobRunRepository);
        }
    }

    @Nested
    @DisplayName("Runs")
    class RunTests {

        @Test
        @DisplayName("Manual trigger should return the running run without waiting")
        void manualTriggerShouldNotWait() {
            // Given
            var job = existingJob();
            var run = JobRun.start(job.getId(), Instant.now());
            run.setId(UUID.randomUUID());
            when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));
            when(jobRunService.openRun(job.getId())).thenReturn(run);
            when(dispatcher.dispatchRun(run)).thenReturn(new CompletableFuture<>());
            when(jobMapper.toRunResponse(run, "Daily digest"))
                    .thenReturn(JobRunResponse.builder().id(run.getId()).status("running").build());

            // When
            var response = service.triggerJobManually(job.getId(), false);

            // Then
            assertThat(response.getId()).isEqualTo(run.getId());
            assertThat(response.getStatus()).isEqualTo("running");
        }

        @Test
        @DisplayName("Should label runs of deleted jobs")
        void shouldLabelRunsOfDeletedJobs() {
            // Given
            var run = JobRun.start(UUID.randomUUID(), Instant.now());
            when(jobRunService.findRecentRuns(50)).thenReturn(List.of(run));
            when(jobRepository.findAllById(any())).thenReturn(List.of());
            when(jobMapper.toRunResponse(eq(run), anyString()))
                    .thenAnswer(inv -> JobRunResponse.builder().jobName(inv.getArgument(1)).build());

            // When
            var runs = service.listRuns(JobManagementService.DEFAULT_RUN_LIMIT);

            // Then
            assertThat(runs).singleElement()
                    .satisfies(response -> assertThat(response.getJobName()).isEqualTo("(deleted job)"));
        }

        @Test
        @DisplayName("Should reject an out-of-range limit")
        void shouldRejectOutOfRangeLimit() {
            assertThatThrownBy(() -> service.listRuns(0)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> service.listRuns(501)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("Should preview a cron expression")
    void shouldPreviewCron() {
        var parsed = service.parseCron("0 9 * * 1");

        assertThat(parsed.getDescription()).isEqualTo("at minute 0, at 9:00 AM, on Monday");
        assertThat(parsed.getNextRuns()).hasSize(5).first().isEqualTo("2024-01-22 09:00:00");
    }
}
