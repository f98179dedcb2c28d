package com.example.canarycontroller.canary;

import com.example.canarycontroller.domain.CanaryDeployment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input for a new deployment. Unset fields come from the referenced template,
 * then from the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CanaryDeploymentRequest {

    private String name;
    private String namespace;
    private String targetDeployment;
    private String clusterId;
    private String templateId;

    private String canaryImage;
    private String canaryVersion;
    private String stableImage;
    private String stableVersion;

    private CanaryDeployment.TrafficSplitType trafficSplitType;
    private Integer initialCanaryPercent;
    private Integer targetCanaryPercent;
    private Integer incrementPercent;
    private Integer incrementIntervalMinutes;

    private Double errorRateThreshold;
    private Long latencyThresholdMs;
    private Double successRateThreshold;
    private Integer minHealthyPods;

    private Boolean autoRollbackEnabled;
    private Boolean rollbackOnErrorRate;
    private Boolean rollbackOnLatency;
    private Boolean rollbackOnPodFailure;
    private Boolean requireManualApproval;

    private String gitCommit;
    private String gitBranch;
    private String pullRequestUrl;
}
