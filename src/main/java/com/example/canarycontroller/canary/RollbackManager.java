package com.example.canarycontroller.canary;

import com.example.canarycontroller.domain.CanaryDeployment;
import com.example.canarycontroller.domain.CanaryDeployment.DeploymentStatus;
import com.example.canarycontroller.domain.DeploymentStep;
import com.example.canarycontroller.domain.RollbackRecord;
import com.example.canarycontroller.error.IllegalTransitionException;
import com.example.canarycontroller.error.ResourceNotFoundException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Rollback Manager - records rollback attempts and drives a deployment through
 * ROLLING_BACK to ROLLED_BACK, or to FAILED when the revert itself fails.
 *
 * The workload revert is performed by the caller; this class only keeps the record
 * and the deployment state consistent with the outcome reported back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RollbackManager {

    private final DeploymentStore store;
    private final DeploymentLockRegistry locks;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    /**
     * Starts a rollback of a deployment that is still shifting traffic or paused.
     */
    public RollbackRecord initiateRollback(String deploymentId, String reason,
                                           RollbackRecord.Trigger trigger, String initiatedBy) {
        CanaryDeployment[] after = new CanaryDeployment[1];
        RollbackRecord record = locks.withLock(deploymentId, () -> store.inTransaction(() -> {
            CanaryDeployment deployment = store.findDeployment(deploymentId)
                    .orElseThrow(() -> ResourceNotFoundException.deployment(deploymentId));
            DeploymentStatus status = deployment.getStatus();
            if (!status.isActive() && status != DeploymentStatus.PAUSED) {
                throw new IllegalTransitionException(deploymentId, status, "roll back");
            }
            RollbackRecord created = initiate(deployment, reason, trigger, initiatedBy);
            after[0] = deployment;
            return created;
        }));
        eventPublisher.publishEvent(CanaryDeploymentEvent.of(
                CanaryDeploymentEvent.Type.ROLLBACK_INITIATED, after[0], initiatedBy));
        return record;
    }

    /**
     * Writes the rollback record and moves the deployment to ROLLING_BACK. Must run under the
     * deployment's lock and inside a store transaction; the caller publishes the event.
     */
    RollbackRecord initiate(CanaryDeployment deployment, String reason,
                            RollbackRecord.Trigger trigger, String initiatedBy) {
        Instant now = Instant.now();
        List<DeploymentStep> steps = store.findSteps(deployment.getId());
        DeploymentStep current = steps.stream()
                .filter(s -> s.getStatus() == DeploymentStep.StepStatus.RUNNING)
                .findFirst()
                .orElseGet(() -> stepAtPercent(steps, deployment.getCurrentCanaryPercent()));

        RollbackRecord record = store.saveRollback(RollbackRecord.builder()
                .deploymentId(deployment.getId())
                .trigger(trigger)
                .canaryPercentAtRollback(deployment.getCurrentCanaryPercent())
                .stepAtRollback(current != null ? current.getStepNumber() : null)
                .rollbackToVersion(deployment.getStableVersion())
                .rollbackToImage(deployment.getStableImage())
                .initiatedBy(initiatedBy)
                .reason(reason)
                .status(RollbackRecord.RollbackStatus.IN_PROGRESS)
                .createdAt(now)
                .build());

        if (current != null && current.getStatus() != DeploymentStep.StepStatus.COMPLETED) {
            current.setStatus(DeploymentStep.StepStatus.FAILED);
            current.setCompletedAt(now);
            store.saveStep(current);
        }

        deployment.setStatus(DeploymentStatus.ROLLING_BACK);
        deployment.setPausedFromStatus(null);
        deployment.setStatusMessage("Rolling back: " + reason);
        deployment.setUpdatedAt(now);
        store.saveDeployment(deployment);

        meterRegistry.counter("canary.rollback.total", "trigger", trigger.name()).increment();
        log.info("Rollback {} initiated for deployment {} at {}% ({}): {}",
                record.getId(), deployment.getId(), record.getCanaryPercentAtRollback(), trigger, reason);
        return record;
    }

    /**
     * Records the outcome of the workload revert for an in-progress rollback.
     */
    public RollbackRecord completeRollback(String rollbackId, boolean success, String errorMessage) {
        RollbackRecord existing = store.findRollback(rollbackId)
                .orElseThrow(() -> ResourceNotFoundException.rollback(rollbackId));
        String deploymentId = existing.getDeploymentId();

        CanaryDeployment[] touched = new CanaryDeployment[1];
        RollbackRecord record = locks.withLock(deploymentId, () -> store.inTransaction(() -> {
            RollbackRecord current = store.findRollback(rollbackId)
                    .orElseThrow(() -> ResourceNotFoundException.rollback(rollbackId));
            if (current.getStatus() != RollbackRecord.RollbackStatus.IN_PROGRESS) {
                throw new IllegalTransitionException(deploymentId, current.getStatus(), "complete rollback");
            }
            Instant now = Instant.now();
            current.setStatus(success ? RollbackRecord.RollbackStatus.COMPLETED : RollbackRecord.RollbackStatus.FAILED);
            current.setErrorMessage(success ? null : errorMessage);
            current.setCompletedAt(now);
            RollbackRecord saved = store.saveRollback(current);

            CanaryDeployment deployment = store.findDeployment(deploymentId).orElse(null);
            if (deployment != null && deployment.getStatus() == DeploymentStatus.ROLLING_BACK) {
                if (success) {
                    deployment.setStatus(DeploymentStatus.ROLLED_BACK);
                    deployment.setCurrentCanaryPercent(0);
                    deployment.setStatusMessage("Successfully rolled back to stable version");
                } else {
                    deployment.setStatus(DeploymentStatus.FAILED);
                    deployment.setStatusMessage("Rollback failed: " + errorMessage);
                }
                deployment.setCompletedAt(now);
                deployment.setUpdatedAt(now);
                store.saveDeployment(deployment);
                skipPendingSteps(deploymentId, now);
                touched[0] = deployment;
            }
            return saved;
        }));

        if (success) {
            log.info("Rollback {} of deployment {} completed", rollbackId, deploymentId);
        } else {
            log.error("Rollback {} of deployment {} failed: {}", rollbackId, deploymentId, errorMessage);
        }
        if (touched[0] != null) {
            eventPublisher.publishEvent(CanaryDeploymentEvent.of(success
                    ? CanaryDeploymentEvent.Type.ROLLED_BACK
                    : CanaryDeploymentEvent.Type.ROLLBACK_FAILED, touched[0], "system"));
        }
        return record;
    }

    public List<RollbackRecord> getRollbackHistory(String deploymentId) {
        return store.findRollbacks(deploymentId);
    }

    void skipPendingSteps(String deploymentId, Instant now) {
        for (DeploymentStep step : store.findSteps(deploymentId)) {
            if (step.getStatus() == DeploymentStep.StepStatus.PENDING) {
                step.setStatus(DeploymentStep.StepStatus.SKIPPED);
                step.setCompletedAt(now);
                store.saveStep(step);
            }
        }
    }

    private DeploymentStep stepAtPercent(List<DeploymentStep> steps, int percent) {
        return steps.stream()
                .filter(s -> s.getTargetPercent() == percent)
                .findFirst()
                .orElse(null);
    }
}
