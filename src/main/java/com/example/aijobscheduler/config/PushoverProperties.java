package com.example.aijobscheduler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Pushover configuration properties
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "pushover")
public class PushoverProperties {
    private boolean enabled = true;
    private String apiUrl = "https://api.pushover.net/1/messages.json";
    private String userKey;
    private String appToken;

    public boolean hasCredentials() {
        return userKey != null && !userKey.isBlank() && appToken != null && !appToken.isBlank();
    }
}
