package com.example.aijobscheduler.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * OpenAI API configuration properties
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "openai")
public class OpenAiProperties {

    @NotBlank
    private String baseUrl = "https://api.openai.com/v1";

    private String apiKey;

    @NotBlank
    private String model = "gpt-4o";

    /**
     * Use the Responses API with the web_search tool instead of chat completions
     */
    private boolean webSearch = true;

    @Min(1)
    private int timeoutSeconds = 600;
}
