package com.example.canarycontroller.canary;

import com.example.canarycontroller.analysis.HealthThresholds;
import com.example.canarycontroller.analysis.HealthVerdict;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AdvisoryRequest {
    private String deploymentId;
    private String deploymentName;
    private String namespace;
    private String targetDeployment;
    private String canaryImage;
    private String canaryVersion;
    private String stableVersion;
    private int currentCanaryPercent;
    private String sampleId;
    private HealthVerdict verdict;
    private HealthThresholds thresholds;
}
