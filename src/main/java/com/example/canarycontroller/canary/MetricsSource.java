package com.example.canarycontroller.canary;

import com.example.canarycontroller.analysis.MetricsSnapshot;
import com.example.canarycontroller.domain.CanaryDeployment;
import com.example.canarycontroller.domain.DeploymentStep;

import java.util.Optional;

/**
 * Supplies the metrics observed for the running step of a deployment.
 */
@FunctionalInterface
public interface MetricsSource {

    /**
     * @return empty when no metrics are available yet
     */
    Optional<MetricsSnapshot> collect(CanaryDeployment deployment, DeploymentStep runningStep);
}
