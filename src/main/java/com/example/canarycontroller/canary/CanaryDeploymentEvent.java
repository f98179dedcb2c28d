package com.example.canarycontroller.canary;

import com.example.canarycontroller.domain.CanaryDeployment;

import java.time.Instant;

/**
 * Lifecycle event published after a deployment operation. Consumed by audit and notifications.
 */
public record CanaryDeploymentEvent(
        Type type,
        String deploymentId,
        String deploymentName,
        CanaryDeployment.DeploymentStatus status,
        int canaryPercent,
        String message,
        String actor,
        Instant timestamp
) {

    public enum Type {
        CREATED, STARTED, PROGRESSED, PAUSED, RESUMED, APPROVED, PROMOTED, CANCELLED,
        ROLLBACK_INITIATED, ROLLED_BACK, ROLLBACK_FAILED, FAILED, DELETED;

        public String auditAction() {
            return "CANARY_" + name();
        }
    }

    public static CanaryDeploymentEvent of(Type type, CanaryDeployment deployment, String actor) {
        return new CanaryDeploymentEvent(type, deployment.getId(), deployment.getName(), deployment.getStatus(),
                deployment.getCurrentCanaryPercent(), deployment.getStatusMessage(), actor, Instant.now());
    }
}
