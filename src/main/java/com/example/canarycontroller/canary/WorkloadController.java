package com.example.canarycontroller.canary;

import com.example.canarycontroller.domain.CanaryDeployment;

/**
 * Applies traffic decisions to the workload. Implementations talk to the cluster;
 * failures are reported by throwing.
 */
public interface WorkloadController {

    void applyTrafficSplit(CanaryDeployment deployment, int canaryPercent) throws Exception;

    void revertToStable(CanaryDeployment deployment) throws Exception;
}
