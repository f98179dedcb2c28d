package com.example.canarycontroller.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Central configuration for the canary controller.
 * Maps to the 'canary-controller' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "canary-controller")
public class CanaryProperties {

    private DeploymentDefaults defaults = new DeploymentDefaults();
    private AdvisorConfig advisor = new AdvisorConfig();
    private DriverConfig driver = new DriverConfig();
    private NotificationConfig notifications = new NotificationConfig();
    private AuditConfig audit = new AuditConfig();

    /** Values applied to a new deployment when neither the request nor its template sets them */
    @Data
    public static class DeploymentDefaults {
        private String namespace = "default";
        private int initialCanaryPercent = 10;
        private int targetCanaryPercent = 100;
        private int incrementPercent = 10;
        private int incrementIntervalMinutes = 5;
        private double errorRateThreshold = 5.0;
        private long latencyThresholdMs = 1000;
        private double successRateThreshold = 95.0;
        private int minHealthyPods = 1;
        private boolean autoRollbackEnabled = true;
        private boolean rollbackOnErrorRate = true;
        private boolean rollbackOnLatency = true;
        private boolean rollbackOnPodFailure = true;
        private boolean requireManualApproval = false;
    }

    @Data
    public static class AdvisorConfig {
        private boolean enabled = true;
        private String provider = "openai";
        private String baseUrl = "";
        private String model = "gpt-4o";
        private String apiKey = "";
        private double temperature = 0.1;
        private int maxTokens = 512;
        private int timeoutSeconds = 30;
    }

    @Data
    public static class DriverConfig {
        /** Poll active rollouts and tick the ones whose increment interval has elapsed */
        private boolean enabled = false;
        private long pollIntervalMs = 30000;
    }

    @Data
    public static class NotificationConfig {
        private SlackConfig slack = new SlackConfig();

        @Data
        public static class SlackConfig {
            private boolean enabled = false;
            private String webhookUrl = "";
        }
    }

    @Data
    public static class AuditConfig {
        private boolean enabled = true;
    }
}
