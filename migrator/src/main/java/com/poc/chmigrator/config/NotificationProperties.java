package com.poc.chmigrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Webhook notification settings.
 */
@Configuration
@ConfigurationProperties(prefix = "migration.notification")
@Data
public class NotificationProperties {

    private boolean enabled = false;

    private String webhookUrl;

    private boolean notifyOnStart = true;
    private boolean notifyOnSuccess = true;
    private boolean notifyOnFailure = true;

    private String projectName = "Data Migration";
    private String envName = "Production";

    /**
     * User ids mentioned at the bottom of each card.
     */
    private List<String> mentionUsers = new ArrayList<>();

    private boolean mentionAll = false;

    private int timeoutSeconds = 10;

    public boolean isActive() {
        return enabled && webhookUrl != null && !webhookUrl.isBlank();
    }
}
