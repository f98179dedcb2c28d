package com.example.canarycontroller.integration;

import com.example.canarycontroller.canary.WorkloadController;
import com.example.canarycontroller.domain.CanaryDeployment;
import lombok.extern.slf4j.Slf4j;

/**
 * Workload controller used when no cluster integration is configured. Records the
 * requested traffic changes in the log and always succeeds.
 */
@Slf4j
public class LoggingWorkloadController implements WorkloadController {

    @Override
    public void applyTrafficSplit(CanaryDeployment deployment, int canaryPercent) {
        log.info("[{}/{}] route {}% to canary {} and {}% to stable {}",
                deployment.getNamespace(), deployment.getTargetDeployment(),
                canaryPercent, deployment.getCanaryImage(),
                100 - canaryPercent, deployment.getStableImage());
    }

    @Override
    public void revertToStable(CanaryDeployment deployment) {
        log.info("[{}/{}] route all traffic back to stable {}",
                deployment.getNamespace(), deployment.getTargetDeployment(),
                deployment.getStableImage() != null ? deployment.getStableImage() : deployment.getStableVersion());
    }
}
