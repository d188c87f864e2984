package com.example.aijobscheduler.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTOs for the OpenAI API. Responses are read as JSON trees.
 */
public class OpenAiModels {
    private OpenAiModels() {
    }

    // === Responses API ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ResponsesRequest {
        private String model;
        private String input;
        private List<Tool> tools;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Tool {
        private String type;

        public static Tool webSearch() {
            return new Tool("web_search");
        }
    }

    // === Chat Completions API ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChatCompletionRequest {
        private String model;
        private List<ChatMessage> messages;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChatMessage {
        private String role;
        private String content;

        public static ChatMessage user(String content) {
            return new ChatMessage("user", content);
        }
    }
}
