package com.example.canarycontroller.service;

import com.example.canarycontroller.canary.CanaryOrchestrator;
import com.example.canarycontroller.canary.MetricsSource;
import com.example.canarycontroller.canary.RolloutDecision;
import com.example.canarycontroller.canary.TrafficAction;
import com.example.canarycontroller.canary.WorkloadController;
import com.example.canarycontroller.config.CanaryProperties;
import com.example.canarycontroller.domain.CanaryDeployment;
import com.example.canarycontroller.error.IllegalTransitionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Rollout Driver - runs engine operations and applies the resulting traffic actions
 * to the workload, reporting workload failures back to the engine.
 *
 * Optionally polls active deployments and ticks those whose increment interval has elapsed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RolloutDriver {

    private final CanaryOrchestrator orchestrator;
    private final WorkloadController workloadController;
    private final MetricsSource metricsSource;
    private final CanaryProperties properties;

    public RolloutDecision start(String id, String actor) {
        return apply(orchestrator.start(id, actor));
    }

    public RolloutDecision tick(String id) {
        return apply(orchestrator.tick(id, metricsSource));
    }

    public RolloutDecision resume(String id, String actor) {
        return apply(orchestrator.resume(id, actor));
    }

    public RolloutDecision promoteNow(String id, String actor) {
        return apply(orchestrator.promoteNow(id, actor));
    }

    public RolloutDecision promoteToStable(String id, String actor) {
        return apply(orchestrator.promoteToStable(id, actor));
    }

    public RolloutDecision rollbackNow(String id, String reason, String actor) {
        return apply(orchestrator.rollbackNow(id, reason, actor));
    }

    /**
     * Ticks every actively shifting deployment whose last progress is older than its interval.
     */
    @Scheduled(fixedDelayString = "${canary-controller.driver.poll-interval-ms:30000}")
    public void pollActiveDeployments() {
        if (!properties.getDriver().isEnabled()) return;

        List<CanaryDeployment> active = orchestrator.findActive();
        if (active.isEmpty()) return;

        Instant now = Instant.now();
        for (CanaryDeployment deployment : active) {
            try {
                if (isDue(deployment, now)) {
                    RolloutDecision decision = tick(deployment.getId());
                    log.debug("Driver ticked deployment {}: {} -> {}", deployment.getId(),
                            decision.action().type(), decision.deployment().getStatus());
                }
            } catch (Exception e) {
                log.error("Driver tick failed for deployment {}: {}", deployment.getId(), e.getMessage());
            }
        }
    }

    boolean isDue(CanaryDeployment deployment, Instant now) {
        Instant last = deployment.getLastProgressAt() != null ? deployment.getLastProgressAt() : deployment.getStartedAt();
        if (last == null) return true;
        Duration interval = Duration.ofMinutes(Math.max(1, deployment.getIncrementIntervalMinutes()));
        return !last.plus(interval).isAfter(now);
    }

    RolloutDecision apply(RolloutDecision decision) {
        TrafficAction action = decision.action();
        CanaryDeployment deployment = decision.deployment();

        switch (action.type()) {
            case APPLY_SPLIT, PROMOTE -> {
                try {
                    workloadController.applyTrafficSplit(deployment, action.canaryPercent());
                    return decision;
                } catch (Exception e) {
                    log.error("Failed to route {}% to canary for deployment {}: {}",
                            action.canaryPercent(), deployment.getId(), e.getMessage());
                    return withDeployment(decision, reportFailure(deployment, describe(e)));
                }
            }
            case REVERT_TO_STABLE -> {
                boolean reverted;
                String error = null;
                try {
                    workloadController.revertToStable(deployment);
                    reverted = true;
                } catch (Exception e) {
                    log.error("Failed to revert deployment {} to stable: {}", deployment.getId(), e.getMessage());
                    reverted = false;
                    error = describe(e);
                }
                try {
                    orchestrator.completeRollback(action.rollbackId(), reverted, error);
                } catch (IllegalTransitionException e) {
                    log.warn("Rollback {} was already closed: {}", action.rollbackId(), e.getMessage());
                }
                return withDeployment(decision, orchestrator.getDeployment(deployment.getId()));
            }
            default -> {
                return decision;
            }
        }
    }

    private CanaryDeployment reportFailure(CanaryDeployment deployment, String message) {
        try {
            return orchestrator.reportExecutionFailure(deployment.getId(), message);
        } catch (IllegalTransitionException e) {
            // Cancelled or finished by another request in the meantime
            log.warn("Could not mark deployment {} failed: {}", deployment.getId(), e.getMessage());
            return orchestrator.getDeployment(deployment.getId());
        }
    }

    private RolloutDecision withDeployment(RolloutDecision decision, CanaryDeployment deployment) {
        return new RolloutDecision(deployment, decision.action(), decision.verdict(),
                decision.rollback(), decision.sampleId());
    }

    private String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
