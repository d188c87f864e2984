package com.example.aijobscheduler.client;

import com.example.aijobscheduler.client.OpenAiModels.ChatCompletionRequest;
import com.example.aijobscheduler.client.OpenAiModels.ChatMessage;
import com.example.aijobscheduler.client.OpenAiModels.ResponsesRequest;
import com.example.aijobscheduler.client.OpenAiModels.Tool;
import com.example.aijobscheduler.config.OpenAiProperties;
import com.example.aijobscheduler.exception.GenerationUnavailableException;
import com.example.aijobscheduler.exception.WorkerExecutionException;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Client for the OpenAI API.
 * <p>
 * With web search enabled it uses the Responses API and the {@code web_search} tool;
 * otherwise it falls back to Chat Completions.
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker for fault tolerance
 * - Retry on transient failures only
 */
@Slf4j
@Component
public class OpenAiGenerationClient implements GenerationClient {

    private final WebClient webClient;
    private final OpenAiProperties properties;

    public OpenAiGenerationClient(@Qualifier("openAiWebClient") WebClient webClient, OpenAiProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    @CircuitBreaker(name = "openai", fallbackMethod = "generateFallback")
    @Retry(name = "openai")
    public String generate(String prompt) {
        if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
            throw new WorkerExecutionException("OpenAI API key is not configured (openai.api-key)");
        }

        log.info("Calling OpenAI API with model {} (web search {})", properties.getModel(),
                properties.isWebSearch() ? "enabled" : "disabled");

        var result = properties.isWebSearch() ? callResponses(prompt) : callChatCompletions(prompt);
        if (result == null || result.isBlank()) {
            throw new WorkerExecutionException("OpenAI API returned no text output");
        }

        log.info("OpenAI API call completed ({} characters returned)", result.length());
        return result;
    }

    /**
     * Fallback method when circuit breaker is open
     */
    @SuppressWarnings("unused")
    private String generateFallback(String prompt, CallNotPermittedException e) {
        log.warn("Circuit breaker open for OpenAI: {}", e.getMessage());
        throw new GenerationUnavailableException("OpenAI temporarily unavailable (circuit breaker open)", e);
    }

    private String callResponses(String prompt) {
        var request = ResponsesRequest.builder()
                .model(properties.getModel())
                .input(prompt)
                .tools(List.of(Tool.webSearch()))
                .build();

        var response = post("/responses", request);
        return extractOutputText(response);
    }

    private String callChatCompletions(String prompt) {
        var request = ChatCompletionRequest.builder()
                .model(properties.getModel())
                .messages(List.of(ChatMessage.user(prompt)))
                .build();

        var response = post("/chat/completions", request);
        return extractChatContent(response);
    }

    private JsonNode post(String path, Object body) {
        try {
            return webClient.post()
                    .uri(path)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(errorBody -> Mono.error(toException(response.statusCode(), errorBody))))
                    .bodyToMono(JsonNode.class)
                    .block();
        } catch (WorkerExecutionException e) {
            throw e;
        } catch (Exception e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new WorkerExecutionException("OpenAI API call interrupted", e);
            }
            log.error("OpenAI API call to {} failed: {}", path, e.getMessage());
            throw new GenerationUnavailableException("OpenAI API call failed: " + e.getMessage(), e);
        }
    }

    private static WorkerExecutionException toException(HttpStatusCode status, String body) {
        var message = "OpenAI API returned HTTP " + status.value() + ": " + body;
        if (status.is5xxServerError() || status.value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return new GenerationUnavailableException(message);
        }
        return new WorkerExecutionException(message);
    }

    /**
     * Concatenate every {@code output_text} part of every message in a Responses API result
     */
    static String extractOutputText(JsonNode response) {
        if (response == null) {
            return null;
        }
        var text = new StringBuilder();
        for (var item : response.path("output")) {
            for (var content : item.path("content")) {
                if ("output_text".equals(content.path("type").asText())) {
                    text.append(content.path("text").asText(""));
                }
            }
        }
        return text.toString();
    }

    static String extractChatContent(JsonNode response) {
        if (response == null) {
            return null;
        }
        var content = response.path("choices").path(0).path("message").path("content");
        return content.isTextual() ? content.asText() : null;
    }
}
