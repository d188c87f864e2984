package com.example.aijobscheduler.service.worker;

import com.example.aijobscheduler.config.JobSchedulerProperties;
import com.example.aijobscheduler.exception.ExecutionTimeoutException;
import com.example.aijobscheduler.exception.WorkerExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the worker as an external process.
 * <p>
 * The command comes from {@code ai-jobs.worker.process.command}; the placeholders
 * {@code {jobId}}, {@code {runId}} and {@code {slug}} are substituted per run and the same
 * values are exported as environment variables. stdout and stderr are captured through
 * temporary files so a chatty worker cannot block on a full pipe.
 * <p>
 * On timeout the process and all of its descendants are killed.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "ai-jobs.worker", name = "mode", havingValue = "process")
public class ProcessWorkerInvocation implements WorkerInvocation {

    static final String ENV_JOB_ID = "AI_JOB_ID";
    static final String ENV_RUN_ID = "AI_JOB_RUN_ID";
    static final String ENV_SLUG = "AI_JOB_SLUG";
    static final String ENV_JOB_NAME = "AI_JOB_NAME";

    private final JobSchedulerProperties properties;

    public ProcessWorkerInvocation(JobSchedulerProperties properties) {
        this.properties = properties;
    }

    @Override
    public WorkerResult invoke(WorkerRequest request, Duration timeout) {
        var command = buildCommand(request);
        if (command.isEmpty()) {
            throw new WorkerExecutionException(request.getJobId(), "no worker command configured (ai-jobs.worker.process.command)");
        }

        Path stdoutFile = null;
        Path stderrFile = null;
        try {
            stdoutFile = Files.createTempFile("job-run-" + request.getRunId(), ".out");
            stderrFile = Files.createTempFile("job-run-" + request.getRunId(), ".err");

            var process = start(request, command, stdoutFile, stderrFile);
            log.info("Started worker process {} for run {} of job '{}'", process.pid(), request.getRunId(), request.getJobName());

            if (!awaitExit(process, timeout, request)) {
                log.warn("Worker process {} for run {} exceeded {}, killing it", process.pid(), request.getRunId(), timeout);
                destroyTree(process);
                throw new ExecutionTimeoutException(request.getJobId(), timeout);
            }

            var exitCode = process.exitValue();
            log.info("Worker process for run {} exited with code {}", request.getRunId(), exitCode);
            return WorkerResult.builder()
                    .exitCode(exitCode)
                    .stdout(Files.readString(stdoutFile, StandardCharsets.UTF_8))
                    .stderr(Files.readString(stderrFile, StandardCharsets.UTF_8))
                    .build();
        } catch (IOException e) {
            throw new WorkerExecutionException(request.getJobId(), "failed to run worker process: " + e.getMessage(), e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    List<String> buildCommand(WorkerRequest request) {
        var command = new ArrayList<String>();
        for (var argument : properties.getWorker().getProcess().getCommand()) {
            command.add(argument
                    .replace("{jobId}", request.getJobId().toString())
                    .replace("{runId}", request.getRunId().toString())
                    .replace("{slug}", request.getSlug()));
        }
        return command;
    }

    private Process start(WorkerRequest request, List<String> command, Path stdoutFile, Path stderrFile) throws IOException {
        var builder = new ProcessBuilder(command)
                .redirectOutput(stdoutFile.toFile())
                .redirectError(stderrFile.toFile());

        var workingDirectory = properties.getWorker().getProcess().getWorkingDirectory();
        if (workingDirectory != null && !workingDirectory.isBlank()) {
            builder.directory(new File(workingDirectory));
        }

        var environment = builder.environment();
        environment.put(ENV_JOB_ID, request.getJobId().toString());
        environment.put(ENV_RUN_ID, request.getRunId().toString());
        environment.put(ENV_SLUG, request.getSlug());
        environment.put(ENV_JOB_NAME, request.getJobName());

        return builder.start();
    }

    private boolean awaitExit(Process process, Duration timeout, WorkerRequest request) {
        try {
            return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            destroyTree(process);
            Thread.currentThread().interrupt();
            throw new WorkerExecutionException(request.getJobId(), "interrupted while waiting for worker process", e);
        }
    }

    private void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(5, TimeUnit.SECONDS)) {
                log.warn("Worker process {} did not terminate after being killed", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temporary file {}: {}", file, e.getMessage());
        }
    }
}
