package com.example.aijobscheduler.service;

import com.example.aijobscheduler.config.JobSchedulerProperties;
import com.example.aijobscheduler.cron.CronExpressionEvaluator;
import com.example.aijobscheduler.domain.entity.Job;
import com.example.aijobscheduler.domain.entity.JobRun;
import com.example.aijobscheduler.domain.repository.JobRepository;
import com.example.aijobscheduler.domain.repository.JobRunRepository;
import com.example.aijobscheduler.dto.CreateJobRequest;
import com.example.aijobscheduler.dto.CronParseResponse;
import com.example.aijobscheduler.dto.JobResponse;
import com.example.aijobscheduler.dto.JobRunResponse;
import com.example.aijobscheduler.dto.SchedulerStatusResponse;
import com.example.aijobscheduler.dto.UpdateJobRequest;
import com.example.aijobscheduler.exception.DuplicateJobException;
import com.example.aijobscheduler.exception.JobNotFoundException;
import com.example.aijobscheduler.exception.JobRunNotFoundException;
import com.example.aijobscheduler.mapper.JobMapper;
import com.example.aijobscheduler.service.executor.JobExecutionDispatcher;
import com.example.aijobscheduler.service.scheduler.JobScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Management operations on jobs and runs.
 * <p>
 * Every job mutation re-synchronizes the scheduler once the store transaction has committed,
 * so a rolled back change never leaves a timer behind.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobManagementService {

    public static final int DEFAULT_RUN_LIMIT = 50;
    public static final int MAX_RUN_LIMIT = 500;

    static final String DELETED_JOB_NAME = "(deleted job)";
    private static final DateTimeFormatter NEXT_RUN_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final JobRepository jobRepository;
    private final JobRunRepository jobRunRepository;
    private final JobRunService jobRunService;
    private final JobScheduler jobScheduler;
    private final JobExecutionDispatcher dispatcher;
    private final CronExpressionEvaluator cronEvaluator;
    private final JobMapper jobMapper;
    private final JobSchedulerProperties properties;

    // === Job Retrieval ===

    @Transactional(readOnly = true)
    public List<JobResponse> listJobs() {
        var jobs = jobRepository.findAllByOrderByCreatedAtDesc();
        var running = jobRunService.findRunningJobIds(jobs.stream().map(Job::getId).toList());
        return jobs.stream()
                .map(job -> toResponse(job, running.contains(job.getId())))
                .toList();
    }

    @Transactional(readOnly = true)
    public JobResponse getJob(UUID jobId) {
        var job = findJob(jobId);
        return toResponse(job, jobRunService.isRunning(jobId));
    }

    // === Job Mutation ===

    @Transactional
    public JobResponse createJob(CreateJobRequest request) {
        var name = request.getName().trim();
        log.info("Creating job '{}'", name);

        cronEvaluator.validate(request.getCronExpression());
        var cron = normalizeCron(request.getCronExpression());

        var slug = slugFor(name);
        if (jobRepository.existsByName(name) || jobRepository.existsBySlug(slug)) {
            throw new DuplicateJobException(name, slug);
        }

        var job = Job.builder()
                .name(name)
                .slug(slug)
                .promptContent(request.getPromptContent())
                .cronExpression(cron)
                .enabled(request.isEnabled())
                .recipients(normalizeRecipients(request.getRecipients()))
                .build();

        var saved = jobRepository.save(job);
        log.info("Created job '{}' ({}) with cron '{}'", saved.getName(), saved.getId(), saved.getCronExpression());

        afterCommit(() -> jobScheduler.addJob(saved));
        return toResponse(saved, false);
    }

    @Transactional
    public JobResponse updateJob(UUID jobId, UpdateJobRequest request) {
        var job = findJob(jobId);
        log.info("Updating job '{}' ({})", job.getName(), jobId);

        if (request.getName() != null) {
            var name = request.getName().trim();
            var slug = slugFor(name);
            if (jobRepository.existsByNameAndIdNot(name, jobId) || jobRepository.existsBySlugAndIdNot(slug, jobId)) {
                throw new DuplicateJobException(name, slug);
            }
            job.rename(name);
        }
        if (request.getPromptContent() != null) {
            job.setPromptContent(request.getPromptContent());
        }
        if (request.getCronExpression() != null) {
            cronEvaluator.validate(request.getCronExpression());
            job.setCronExpression(normalizeCron(request.getCronExpression()));
        }
        if (request.getEnabled() != null) {
            job.setEnabled(request.getEnabled());
        }
        if (request.getRecipients() != null) {
            job.getRecipients().clear();
            job.getRecipients().addAll(normalizeRecipients(request.getRecipients()));
        } else {
            addDefaultRecipient(job.getRecipients());
        }

        var saved = jobRepository.saveAndFlush(job);
        afterCommit(() -> jobScheduler.updateJob(saved));
        return toResponse(saved, jobRunService.isRunning(jobId));
    }

    /**
     * Delete a job with its run history. A run in flight keeps going but its record is gone,
     * so its final update is discarded.
     */
    @Transactional
    public void deleteJob(UUID jobId) {
        var job = findJob(jobId);
        log.info("Deleting job '{}' ({})", job.getName(), jobId);

        var deletedRuns = jobRunRepository.deleteByJobId(jobId);
        jobRepository.delete(job);
        log.info("Deleted job {} and {} runs", jobId, deletedRuns);

        afterCommit(() -> jobScheduler.removeJob(jobId));
    }

    // === Execution ===

    /**
     * Start a run now, outside the schedule.
     *
     * @param wait block until the run reaches a terminal state
     * @return the run, RUNNING unless {@code wait} is set
     */
    public JobRunResponse triggerJobManually(UUID jobId, boolean wait) {
        var job = findJob(jobId);
        log.info("Manual trigger of job '{}' ({})", job.getName(), jobId);

        var run = jobRunService.openRun(jobId);
        var future = dispatcher.dispatchRun(run);

        if (!wait) {
            return jobMapper.toRunResponse(run, job.getName());
        }

        var report = future.join();
        log.info("Manual run {} of job '{}' finished: {}", run.getId(), job.getName(), report.getOutcome());
        return jobRunService.findRun(run.getId())
                .map(completed -> jobMapper.toRunResponse(completed, job.getName()))
                .orElseGet(() -> jobMapper.toRunResponse(run, job.getName()));
    }

    // === Runs ===

    @Transactional(readOnly = true)
    public List<JobRunResponse> listRuns(int limit) {
        if (limit < 1 || limit > MAX_RUN_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_RUN_LIMIT);
        }

        var runs = jobRunService.findRecentRuns(limit);
        var jobNames = jobNames(runs.stream().map(JobRun::getJobId).collect(Collectors.toSet()));

        return runs.stream()
                .map(run -> jobMapper.toRunResponse(run, jobNames.getOrDefault(run.getJobId(), DELETED_JOB_NAME)))
                .toList();
    }

    @Transactional(readOnly = true)
    public JobRunResponse getRun(UUID runId) {
        var run = jobRunService.findRun(runId).orElseThrow(() -> new JobRunNotFoundException(runId));
        var jobName = jobRepository.findById(run.getJobId()).map(Job::getName).orElse(DELETED_JOB_NAME);
        return jobMapper.toRunResponse(run, jobName);
    }

    // === Status ===

    @Transactional(readOnly = true)
    public SchedulerStatusResponse schedulerStatus() {
        var status = jobScheduler.status();
        return SchedulerStatusResponse.builder()
                .schedulerRunning(status.isRunning())
                .armedJobsCount(status.getArmedCount())
                .activeJobsCount(jobRepository.countByEnabledTrue())
                .totalJobsCount(jobRepository.count())
                .build();
    }

    public CronParseResponse parseCron(String expression) {
        var parsed = cronEvaluator.parse(expression);
        return CronParseResponse.builder()
                .cronExpression(parsed.getExpression())
                .description(parsed.getDescription())
                .nextRuns(parsed.getNextRuns().stream().map(NEXT_RUN_FORMAT::format).toList())
                .build();
    }

    // === Helpers ===

    private Job findJob(UUID jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private JobResponse toResponse(Job job, boolean running) {
        var response = jobMapper.toResponse(job);
        response.setRunning(running);
        if (job.isEnabled()) {
            var next = cronEvaluator.nextFireTimes(job.getCronExpression(), cronEvaluator.now(), 1);
            response.setNextRunAt(next.isEmpty() ? null : next.get(0));
        }
        return response;
    }

    private Map<UUID, String> jobNames(Collection<UUID> jobIds) {
        return jobRepository.findAllById(jobIds).stream()
                .collect(Collectors.toMap(Job::getId, Job::getName));
    }

    private static String slugFor(String name) {
        var slug = Job.slugify(name);
        if (slug.isEmpty()) {
            throw new IllegalArgumentException("Job name must contain at least one letter or digit");
        }
        return slug;
    }

    private static String normalizeCron(String expression) {
        return String.join(" ", expression.trim().split("\\s+"));
    }

    private Set<String> normalizeRecipients(Collection<String> recipients) {
        var normalized = new LinkedHashSet<String>();
        if (recipients != null) {
            recipients.stream()
                    .filter(recipient -> recipient != null && !recipient.isBlank())
                    .map(String::trim)
                    .forEach(normalized::add);
        }
        addDefaultRecipient(normalized);
        return normalized;
    }

    private void addDefaultRecipient(Set<String> recipients) {
        var defaultRecipient = properties.getNotifications().getEmail().getDefaultRecipient();
        if (defaultRecipient != null && !defaultRecipient.isBlank()) {
            recipients.add(defaultRecipient.trim());
        }
    }

    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }
}
