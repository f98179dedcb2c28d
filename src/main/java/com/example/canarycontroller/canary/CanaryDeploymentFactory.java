package com.example.canarycontroller.canary;

import com.example.canarycontroller.config.CanaryProperties;
import com.example.canarycontroller.domain.CanaryDeployment;
import com.example.canarycontroller.domain.CanaryTemplate;
import com.example.canarycontroller.error.InvalidConfigurationException;
import com.example.canarycontroller.error.ResourceNotFoundException;
import com.example.canarycontroller.repository.CanaryTemplateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Builds a validated PENDING deployment from a request, an optional template and the
 * configured defaults, in that order of precedence.
 */
@Component
@RequiredArgsConstructor
public class CanaryDeploymentFactory {

    private final CanaryProperties properties;
    private final CanaryTemplateRepository templateRepository;

    /**
     * Resolves {@code request.templateId}, when set, before building.
     */
    public CanaryDeployment build(CanaryDeploymentRequest request, String createdBy) {
        CanaryTemplate template = null;
        if (request != null && !isBlank(request.getTemplateId())) {
            template = templateRepository.findById(request.getTemplateId())
                    .orElseThrow(() -> ResourceNotFoundException.template(request.getTemplateId()));
        }
        return build(request, template, createdBy);
    }

    public CanaryDeployment build(CanaryDeploymentRequest request, CanaryTemplate template, String createdBy) {
        if (request == null) {
            throw new InvalidConfigurationException("Deployment request is required");
        }
        CanaryProperties.DeploymentDefaults defaults = properties.getDefaults();
        CanaryTemplate t = template != null ? template : new CanaryTemplate();

        String targetDeployment = required("targetDeployment", request.getTargetDeployment());
        String canaryImage = required("canaryImage", request.getCanaryImage());
        String name = isBlank(request.getName()) ? targetDeployment + "-canary" : request.getName();

        CanaryDeployment deployment = CanaryDeployment.builder()
                .name(name)
                .namespace(isBlank(request.getNamespace()) ? defaults.getNamespace() : request.getNamespace())
                .targetDeployment(targetDeployment)
                .clusterId(request.getClusterId())
                .canaryImage(canaryImage)
                .canaryVersion(request.getCanaryVersion())
                .stableImage(request.getStableImage())
                .stableVersion(request.getStableVersion())
                .trafficSplitType(first(request.getTrafficSplitType(), t.getTrafficSplitType(),
                        CanaryDeployment.TrafficSplitType.PERCENTAGE))
                .initialCanaryPercent(first(request.getInitialCanaryPercent(), t.getInitialCanaryPercent(),
                        defaults.getInitialCanaryPercent()))
                .targetCanaryPercent(first(request.getTargetCanaryPercent(), null, defaults.getTargetCanaryPercent()))
                .incrementPercent(first(request.getIncrementPercent(), t.getIncrementPercent(),
                        defaults.getIncrementPercent()))
                .incrementIntervalMinutes(first(request.getIncrementIntervalMinutes(), t.getIncrementIntervalMinutes(),
                        defaults.getIncrementIntervalMinutes()))
                .errorRateThreshold(first(request.getErrorRateThreshold(), t.getErrorRateThreshold(),
                        defaults.getErrorRateThreshold()))
                .latencyThresholdMs(first(request.getLatencyThresholdMs(), t.getLatencyThresholdMs(),
                        defaults.getLatencyThresholdMs()))
                .successRateThreshold(first(request.getSuccessRateThreshold(), t.getSuccessRateThreshold(),
                        defaults.getSuccessRateThreshold()))
                .minHealthyPods(first(request.getMinHealthyPods(), null, defaults.getMinHealthyPods()))
                .autoRollbackEnabled(first(request.getAutoRollbackEnabled(), t.getAutoRollbackEnabled(),
                        defaults.isAutoRollbackEnabled()))
                .rollbackOnErrorRate(first(request.getRollbackOnErrorRate(), null, defaults.isRollbackOnErrorRate()))
                .rollbackOnLatency(first(request.getRollbackOnLatency(), null, defaults.isRollbackOnLatency()))
                .rollbackOnPodFailure(first(request.getRollbackOnPodFailure(), null, defaults.isRollbackOnPodFailure()))
                .requireManualApproval(first(request.getRequireManualApproval(), t.getRequireManualApproval(),
                        defaults.isRequireManualApproval()))
                .status(CanaryDeployment.DeploymentStatus.PENDING)
                .currentCanaryPercent(0)
                .createdBy(createdBy)
                .gitCommit(request.getGitCommit())
                .gitBranch(request.getGitBranch())
                .pullRequestUrl(request.getPullRequestUrl())
                .createdAt(Instant.now())
                .build();

        validate(deployment);
        return deployment;
    }

    void validate(CanaryDeployment d) {
        percent("initialCanaryPercent", d.getInitialCanaryPercent());
        percent("targetCanaryPercent", d.getTargetCanaryPercent());
        percent("incrementPercent", d.getIncrementPercent());
        if (d.getIncrementIntervalMinutes() < 1) {
            throw new InvalidConfigurationException("incrementIntervalMinutes", d.getIncrementIntervalMinutes(),
                    "must be at least 1");
        }
        threshold("errorRateThreshold", d.getErrorRateThreshold());
        threshold("successRateThreshold", d.getSuccessRateThreshold());
        if (d.getLatencyThresholdMs() < 0) {
            throw new InvalidConfigurationException("latencyThresholdMs", d.getLatencyThresholdMs(),
                    "must not be negative");
        }
        if (d.getMinHealthyPods() < 1) {
            throw new InvalidConfigurationException("minHealthyPods", d.getMinHealthyPods(), "must be at least 1");
        }
        // Plan shape (initial <= target etc.)
        StepPlanner.plan(d.getInitialCanaryPercent(), d.getTargetCanaryPercent(), d.getIncrementPercent());
    }

    private void percent(String field, int value) {
        if (value < 1 || value > 100) {
            throw new InvalidConfigurationException(field, value, "must be between 1 and 100");
        }
    }

    private void threshold(String field, double value) {
        if (Double.isNaN(value) || value < 0 || value > 100) {
            throw new InvalidConfigurationException(field, value, "must be between 0 and 100");
        }
    }

    private String required(String field, String value) {
        if (isBlank(value)) {
            throw new InvalidConfigurationException(field, value, "is required");
        }
        return value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static <T> T first(T requested, T fromTemplate, T fallback) {
        if (requested != null) return requested;
        if (fromTemplate != null) return fromTemplate;
        return fallback;
    }
}
