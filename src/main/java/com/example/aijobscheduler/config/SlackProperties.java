package com.example.aijobscheduler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Slack configuration properties
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {
    private String webhookUrl;
    private String channel = "#ai-jobs";
    private boolean enabled = false;

    /**
     * Base URL used to link a run from the message, e.g. http://localhost:8080
     */
    private String dashboardBaseUrl;
}
