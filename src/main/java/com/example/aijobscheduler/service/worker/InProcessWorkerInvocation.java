package com.example.aijobscheduler.service.worker;

import com.example.aijobscheduler.client.GenerationClient;
import com.example.aijobscheduler.exception.ExecutionTimeoutException;
import com.example.aijobscheduler.exception.WorkerExecutionException;
import com.example.aijobscheduler.service.JobRunService;
import com.example.aijobscheduler.service.render.MarkdownRenderer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs generation inside the application on a dedicated pool.
 * <p>
 * The generated markdown and its HTML rendering are written back to the run record
 * as soon as they are available, and the markdown is also returned directly.
 * On timeout the generation thread is interrupted.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "ai-jobs.worker", name = "mode", havingValue = "in-process", matchIfMissing = true)
public class InProcessWorkerInvocation implements WorkerInvocation {

    private final GenerationClient generationClient;
    private final JobRunService jobRunService;
    private final MarkdownRenderer markdownRenderer;
    private final ThreadPoolTaskExecutor generationExecutor;

    public InProcessWorkerInvocation(GenerationClient generationClient, JobRunService jobRunService, MarkdownRenderer markdownRenderer,
                                     @Qualifier("generationExecutor") ThreadPoolTaskExecutor generationExecutor) {
        this.generationClient = generationClient;
        this.jobRunService = jobRunService;
        this.markdownRenderer = markdownRenderer;
        this.generationExecutor = generationExecutor;
    }

    @Override
    public WorkerResult invoke(WorkerRequest request, Duration timeout) {
        var runLog = new StringBuilder();
        runLog.append("Generating content for job '").append(request.getJobName()).append("'\n");

        var future = submit(request);
        String output;
        try {
            output = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExecutionTimeoutException(request.getJobId(), timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new WorkerExecutionException(request.getJobId(), "interrupted while waiting for generation", e);
        } catch (ExecutionException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Generation failed for run {}: {}", request.getRunId(), cause.getMessage());
            return WorkerResult.failure(1, cause.getMessage(), cause.toString());
        }

        runLog.append("Generated ").append(output.length()).append(" characters\n");
        recordOutput(request, output, runLog);
        return WorkerResult.success(output, runLog.toString());
    }

    private Future<String> submit(WorkerRequest request) {
        try {
            return generationExecutor.getThreadPoolExecutor().submit(() -> generationClient.generate(request.getPrompt()));
        } catch (RejectedExecutionException e) {
            throw new WorkerExecutionException(request.getJobId(), "generation pool is saturated", e);
        }
    }

    private void recordOutput(WorkerRequest request, String output, StringBuilder runLog) {
        String html = null;
        try {
            html = markdownRenderer.toHtmlDocument(output);
            runLog.append("Converted markdown to HTML (").append(html.length()).append(" characters)\n");
        } catch (RuntimeException e) {
            log.warn("Failed to convert output of run {} to HTML: {}", request.getRunId(), e.getMessage());
            runLog.append("HTML conversion failed: ").append(e.getMessage()).append('\n');
        }

        try {
            jobRunService.recordOutput(request.getRunId(), output, html);
        } catch (RuntimeException e) {
            log.warn("Failed to write output of run {} back to the store: {}", request.getRunId(), e.getMessage());
        }
    }
}
