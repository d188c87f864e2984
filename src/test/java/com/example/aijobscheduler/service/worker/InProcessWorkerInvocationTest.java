package com.example.aijobscheduler.service.worker;

import com.example.aijobscheduler.client.GenerationClient;
import com.example.aijobscheduler.exception.ExecutionTimeoutException;
import com.example.aijobscheduler.exception.GenerationUnavailableException;
import com.example.aijobscheduler.service.JobRunService;
import com.example.aijobscheduler.service.render.MarkdownRenderer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("InProcessWorkerInvocation Tests")
class InProcessWorkerInvocationTest {

    @Mock
    private GenerationClient generationClient;

    @Mock
    private JobRunService jobRunService;

    @Mock
    private MarkdownRenderer markdownRenderer;

    private ThreadPoolTaskExecutor generationExecutor;
    private InProcessWorkerInvocation invocation;
    private WorkerRequest request;

    @BeforeEach
    void setUp() {
        generationExecutor = new ThreadPoolTaskExecutor();
        generationExecutor.setCorePoolSize(1);
        generationExecutor.setMaxPoolSize(1);
        generationExecutor.setThreadNamePrefix("test-generation-");
        generationExecutor.initialize();

        invocation = new InProcessWorkerInvocation(generationClient, jobRunService, markdownRenderer, generationExecutor);
        request = WorkerRequest.builder()
                .jobId(UUID.randomUUID())
                .runId(UUID.randomUUID())
                .jobName("Daily digest")
                .slug("daily-digest")
                .prompt("Summarize the news")
                .build();
    }

    @AfterEach
    void tearDown() {
        generationExecutor.shutdown();
    }

    @Test
    @DisplayName("Should return output and write it back to the run")
    void shouldReturnAndRecordOutput() {
        // Given
        when(generationClient.generate("Summarize the news")).thenReturn("# Digest");
        when(markdownRenderer.toHtmlDocument("# Digest")).thenReturn("<h1>Digest</h1>");

        // When
        var result = invocation.invoke(request, Duration.ofSeconds(5));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOutput()).isEqualTo("# Digest");
        assertThat(result.getStdout()).contains("Generated 8 characters");
        verify(jobRunService).recordOutput(request.getRunId(), "# Digest", "<h1>Digest</h1>");
    }

    @Test
    @DisplayName("Should still succeed when HTML rendering fails")
    void shouldSucceedWhenRenderingFails() {
        // Given
        when(generationClient.generate(anyString())).thenReturn("# Digest");
        when(markdownRenderer.toHtmlDocument(anyString())).thenThrow(new IllegalStateException("bad markdown"));

        // When
        var result = invocation.invoke(request, Duration.ofSeconds(5));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStdout()).contains("HTML conversion failed: bad markdown");
        verify(jobRunService).recordOutput(request.getRunId(), "# Digest", null);
    }

    @Test
    @DisplayName("Should turn a generation error into a failed result")
    void shouldReportGenerationError() {
        // Given
        when(generationClient.generate(anyString()))
                .thenThrow(new GenerationUnavailableException("OpenAI is unavailable (HTTP 503)"));

        // When
        var result = invocation.invoke(request, Duration.ofSeconds(5));

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getExitCode()).isEqualTo(1);
        assertThat(result.getErrorDetail()).isEqualTo("OpenAI is unavailable (HTTP 503)");
        verifyNoInteractions(jobRunService);
    }

    @Test
    @DisplayName("Should interrupt generation that exceeds its budget")
    void shouldInterruptOnTimeout() throws InterruptedException {
        // Given
        var interrupted = new CountDownLatch(1);
        when(generationClient.generate(anyString())).thenAnswer(inv -> {
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return "too late";
        });

        // When / Then
        assertThatThrownBy(() -> invocation.invoke(request, Duration.ofMillis(200)))
                .isInstanceOf(ExecutionTimeoutException.class);
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        verifyNoInteractions(jobRunService);
    }
}
