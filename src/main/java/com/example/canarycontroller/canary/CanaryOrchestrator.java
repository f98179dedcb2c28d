package com.example.canarycontroller.canary;

import com.example.canarycontroller.analysis.HealthAnalyzer;
import com.example.canarycontroller.analysis.HealthThresholds;
import com.example.canarycontroller.analysis.HealthVerdict;
import com.example.canarycontroller.analysis.MetricsSnapshot;
import com.example.canarycontroller.domain.CanaryDeployment;
import com.example.canarycontroller.domain.CanaryDeployment.DeploymentStatus;
import com.example.canarycontroller.domain.CanaryMetricSample;
import com.example.canarycontroller.domain.DeploymentStep;
import com.example.canarycontroller.domain.DeploymentStep.StepStatus;
import com.example.canarycontroller.domain.RollbackRecord;
import com.example.canarycontroller.error.IllegalTransitionException;
import com.example.canarycontroller.error.ResourceNotFoundException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Progression Engine - the canary deployment state machine.
 *
 * PENDING -> INITIALIZING -> PROGRESSING <-> PAUSED -> PROMOTED
 *                                                   -> ROLLING_BACK -> ROLLED_BACK | FAILED
 * Any non-terminal state may be CANCELLED.
 *
 * The engine never touches the workload and never schedules itself. Each operation returns
 * a {@link RolloutDecision} whose {@link TrafficAction} the caller applies, and the caller
 * decides when to {@link #tick} again.
 *
 * Every mutating operation holds the deployment's lock, runs in one store transaction and
 * re-reads the deployment first, so a cancel or pause is always seen by the next tick.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CanaryOrchestrator {

    static final String AWAITING_APPROVAL = "Awaiting manual approval";
    static final String SYSTEM_ACTOR = "system";

    private final DeploymentStore store;
    private final DeploymentLockRegistry locks;
    private final CanaryDeploymentFactory factory;
    private final HealthAnalyzer analyzer;
    private final RollbackManager rollbackManager;
    private final AdvisoryDispatcher advisoryDispatcher;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    // ==================== Lifecycle ====================

    public CanaryDeployment create(CanaryDeploymentRequest request, String createdBy) {
        CanaryDeployment draft = factory.build(request, createdBy);
        CanaryDeployment saved = store.inTransaction(() -> {
            CanaryDeployment deployment = store.saveDeployment(draft);
            store.saveSteps(StepPlanner.buildSteps(deployment.getId(), deployment.getInitialCanaryPercent(),
                    deployment.getTargetCanaryPercent(), deployment.getIncrementPercent()));
            return deployment;
        });
        log.info("Created canary deployment {} ({}) for {}/{}: {}% -> {}% by {}%",
                saved.getId(), saved.getName(), saved.getNamespace(), saved.getTargetDeployment(),
                saved.getInitialCanaryPercent(), saved.getTargetCanaryPercent(), saved.getIncrementPercent());
        eventPublisher.publishEvent(CanaryDeploymentEvent.of(CanaryDeploymentEvent.Type.CREATED, saved, createdBy));
        return saved;
    }

    public RolloutDecision start(String id, String actor) {
        return mutate(id, (deployment, events) -> {
            DeploymentStatus status = deployment.getStatus();
            if (status == DeploymentStatus.PAUSED && deployment.getStartedAt() != null) {
                return resumeLocked(deployment, actor, events);
            }
            if (status != DeploymentStatus.PENDING && status != DeploymentStatus.PAUSED) {
                throw new IllegalTransitionException(id, status, "start");
            }

            Instant now = Instant.now();
            List<DeploymentStep> steps = store.findSteps(id);
            DeploymentStep first = steps.get(0);
            first.setStatus(StepStatus.RUNNING);
            first.setStartedAt(now);
            store.saveStep(first);

            deployment.setStatus(DeploymentStatus.INITIALIZING);
            deployment.setPausedFromStatus(null);
            deployment.setCurrentCanaryPercent(first.getTargetPercent());
            deployment.setStartedAt(now);
            deployment.setLastProgressAt(now);
            deployment.setStatusMessage("Canary started at " + first.getTargetPercent() + "%");
            touch(deployment, now);

            log.info("Started canary deployment {} at {}%", id, first.getTargetPercent());
            events.add(CanaryDeploymentEvent.of(CanaryDeploymentEvent.Type.STARTED, deployment, actor));
            return RolloutDecision.of(deployment, TrafficAction.applySplit(first.getTargetPercent()));
        });
    }

    /**
     * One evaluation cycle: collect metrics for the running step, analyze them, and
     * advance, hold or roll back. Deployments that are not actively shifting traffic are
     * returned unchanged.
     */
    public RolloutDecision tick(String id, MetricsSource metricsSource) {
        RolloutDecision decision = mutate(id, (deployment, events) -> {
            if (!deployment.getStatus().isActive()) {
                log.debug("Tick ignored for deployment {} in state {}", id, deployment.getStatus());
                return RolloutDecision.unchanged(deployment);
            }

            Instant now = Instant.now();
            List<DeploymentStep> steps = store.findSteps(id);
            Optional<DeploymentStep> running = runningStep(steps);
            if (running.isEmpty()) {
                log.warn("Deployment {} is {} without a running step; tick ignored", id, deployment.getStatus());
                return RolloutDecision.unchanged(deployment);
            }
            DeploymentStep step = running.get();

            MetricsSnapshot snapshot = collect(metricsSource, deployment, step);
            HealthVerdict verdict = analyzer.analyze(HealthThresholds.from(deployment), snapshot);
            CanaryMetricSample sample = store.saveMetricSample(toSample(deployment, step, verdict, now));

            if (verdict.isShouldRollback()) {
                String reason = verdict.getReasons().isEmpty() ? "Health check failed" : verdict.getReasons().get(0);
                RollbackRecord rollback = rollbackManager.initiate(deployment, reason,
                        triggerFor(verdict.getRollbackDimensions()), SYSTEM_ACTOR);
                events.add(CanaryDeploymentEvent.of(CanaryDeploymentEvent.Type.ROLLBACK_INITIATED, deployment, SYSTEM_ACTOR));
                return new RolloutDecision(deployment, TrafficAction.revertToStable(rollback.getId()),
                        verdict, rollback, sample.getId());
            }

            if (verdict.isShouldPromote()) {
                if (deployment.isRequireManualApproval() && !deployment.isApproved()) {
                    if (!AWAITING_APPROVAL.equals(deployment.getStatusMessage())) {
                        deployment.setStatusMessage(AWAITING_APPROVAL);
                        touch(deployment, now);
                    }
                    log.debug("Deployment {} healthy at {}% but awaiting manual approval", id,
                            deployment.getCurrentCanaryPercent());
                    return new RolloutDecision(deployment, TrafficAction.none(), verdict, null, sample.getId());
                }
                TrafficAction action = advance(deployment, steps, step, now, SYSTEM_ACTOR, events);
                return new RolloutDecision(deployment, action, verdict, null, sample.getId());
            }

            log.debug("Holding deployment {} at {}%: {} {}", id, deployment.getCurrentCanaryPercent(),
                    verdict.getAnalysisResult(), verdict.getReasons());
            return new RolloutDecision(deployment, TrafficAction.none(), verdict, null, sample.getId());
        });

        meterRegistry.counter("canary.tick.total", "outcome", outcome(decision)).increment();
        requestAdvice(decision);
        return decision;
    }

    public CanaryDeployment pause(String id, String actor) {
        return mutate(id, (deployment, events) -> {
            DeploymentStatus status = deployment.getStatus();
            if (!status.isActive() && status != DeploymentStatus.PENDING) {
                throw new IllegalTransitionException(id, status, "pause");
            }
            Instant now = Instant.now();
            runningStep(store.findSteps(id)).ifPresent(step -> {
                step.setStatus(StepStatus.PENDING);
                store.saveStep(step);
            });
            deployment.setPausedFromStatus(status);
            deployment.setStatus(DeploymentStatus.PAUSED);
            deployment.setStatusMessage("Deployment paused by user");
            touch(deployment, now);

            log.info("Paused deployment {} at {}% (was {})", id, deployment.getCurrentCanaryPercent(), status);
            events.add(CanaryDeploymentEvent.of(CanaryDeploymentEvent.Type.PAUSED, deployment, actor));
            return RolloutDecision.unchanged(deployment);
        }).deployment();
    }

    public RolloutDecision resume(String id, String actor) {
        return mutate(id, (deployment, events) -> {
            if (deployment.getStatus() != DeploymentStatus.PAUSED) {
                throw new IllegalTransitionException(id, deployment.getStatus(), "resume");
            }
            return resumeLocked(deployment, actor, events);
        });
    }

    public CanaryDeployment cancel(String id, String actor) {
        return mutate(id, (deployment, events) -> {
            if (deployment.isTerminal()) {
                throw new IllegalTransitionException(id, deployment.getStatus(), "cancel");
            }
            Instant now = Instant.now();
            rollbackManager.skipPendingSteps(id, now);
            deployment.setStatus(DeploymentStatus.CANCELLED);
            deployment.setPausedFromStatus(null);
            deployment.setStatusMessage("Deployment cancelled by user");
            deployment.setCompletedAt(now);
            touch(deployment, now);

            log.info("Cancelled deployment {} at {}%", id, deployment.getCurrentCanaryPercent());
            events.add(CanaryDeploymentEvent.of(CanaryDeploymentEvent.Type.CANCELLED, deployment, actor));
            return RolloutDecision.unchanged(deployment);
        }).deployment();
    }

    public CanaryDeployment approve(String id, String actor) {
        return mutate(id, (deployment, events) -> {
            if (deployment.isTerminal() || deployment.getStatus() == DeploymentStatus.ROLLING_BACK) {
                throw new IllegalTransitionException(id, deployment.getStatus(), "approve");
            }
            Instant now = Instant.now();
            deployment.setApprovedBy(actor);
            deployment.setApprovedAt(now);
            if (AWAITING_APPROVAL.equals(deployment.getStatusMessage())) {
                deployment.setStatusMessage("Approved by " + actor);
            }
            touch(deployment, now);

            log.info("Deployment {} approved by {}", id, actor);
            events.add(CanaryDeploymentEvent.of(CanaryDeploymentEvent.Type.APPROVED, deployment, actor));
            return RolloutDecision.unchanged(deployment);
        }).deployment();
    }

    // ==================== Manual overrides ====================

    /**
     * Advances one step without consulting the analyzer or the approval gate.
     */
    public RolloutDecision promoteNow(String id, String actor) {
        return mutate(id, (deployment, events) -> {
            if (!deployment.getStatus().isActive()) {
                throw new IllegalTransitionException(id, deployment.getStatus(), "promote");
            }
            List<DeploymentStep> steps = store.findSteps(id);
            DeploymentStep step = runningStep(steps)
                    .orElseThrow(() -> new IllegalTransitionException(id, deployment.getStatus(), "promote"));
            TrafficAction action = advance(deployment, steps, step, Instant.now(), actor, events);
            log.info("Deployment {} manually advanced by {} to {}%", id, actor, deployment.getCurrentCanaryPercent());
            return RolloutDecision.of(deployment, action);
        });
    }

    /**
     * Sends all traffic to the canary immediately and finishes the rollout.
     */
    public RolloutDecision promoteToStable(String id, String actor) {
        return mutate(id, (deployment, events) -> {
            DeploymentStatus status = deployment.getStatus();
            if (!status.isActive() && status != DeploymentStatus.PAUSED) {
                throw new IllegalTransitionException(id, status, "promote to stable");
            }
            Instant now = Instant.now();
            runningStep(store.findSteps(id)).ifPresent(step -> {
                step.setStatus(StepStatus.COMPLETED);
                step.setCompletedAt(now);
                store.saveStep(step);
            });
            rollbackManager.skipPendingSteps(id, now);
            markPromoted(deployment, now);

            log.info("Deployment {} promoted to stable by {}", id, actor);
            events.add(CanaryDeploymentEvent.of(CanaryDeploymentEvent.Type.PROMOTED, deployment, actor));
            return RolloutDecision.of(deployment, TrafficAction.promote());
        });
    }

    public RolloutDecision rollbackNow(String id, String reason, String actor) {
        return locks.withLock(id, () -> {
            RollbackRecord rollback = rollbackManager.initiateRollback(id,
                    reason == null || reason.isBlank() ? "Manual rollback" : reason,
                    RollbackRecord.Trigger.MANUAL, actor);
            return new RolloutDecision(getDeployment(id), TrafficAction.revertToStable(rollback.getId()),
                    null, rollback, null);
        });
    }

    public RollbackRecord completeRollback(String rollbackId, boolean success, String errorMessage) {
        return rollbackManager.completeRollback(rollbackId, success, errorMessage);
    }

    /**
     * The workload controller could not apply a decided split. The deployment fails for good;
     * it is not retried.
     */
    public CanaryDeployment reportExecutionFailure(String id, String message) {
        return mutate(id, (deployment, events) -> {
            if (deployment.isTerminal()) {
                throw new IllegalTransitionException(id, deployment.getStatus(), "report failure for");
            }
            Instant now = Instant.now();
            for (DeploymentStep step : store.findSteps(id)) {
                if (step.getStatus() == StepStatus.RUNNING) {
                    step.setStatus(StepStatus.FAILED);
                    step.setCompletedAt(now);
                    store.saveStep(step);
                } else if (step.getStatus() == StepStatus.PENDING) {
                    step.setStatus(StepStatus.SKIPPED);
                    step.setCompletedAt(now);
                    store.saveStep(step);
                }
            }
            for (RollbackRecord rollback : store.findRollbacks(id)) {
                if (rollback.getStatus() == RollbackRecord.RollbackStatus.IN_PROGRESS) {
                    rollback.setStatus(RollbackRecord.RollbackStatus.FAILED);
                    rollback.setErrorMessage(message);
                    rollback.setCompletedAt(now);
                    store.saveRollback(rollback);
                }
            }
            deployment.setStatus(DeploymentStatus.FAILED);
            deployment.setPausedFromStatus(null);
            deployment.setStatusMessage("Execution failed: " + message);
            deployment.setCompletedAt(now);
            touch(deployment, now);

            log.error("Deployment {} failed while applying traffic at {}%: {}", id,
                    deployment.getCurrentCanaryPercent(), message);
            events.add(CanaryDeploymentEvent.of(CanaryDeploymentEvent.Type.FAILED, deployment, SYSTEM_ACTOR));
            return RolloutDecision.unchanged(deployment);
        }).deployment();
    }

    public void delete(String id, String actor) {
        CanaryDeployment deleted = locks.withLock(id, () -> store.inTransaction(() -> {
            CanaryDeployment deployment = load(id);
            DeploymentStatus status = deployment.getStatus();
            if (status.isActive() || status == DeploymentStatus.ROLLING_BACK) {
                throw new IllegalTransitionException(id, status, "delete");
            }
            store.deleteDeployment(id);
            log.info("Deleted deployment {} ({})", id, status);
            return deployment;
        }));
        eventPublisher.publishEvent(CanaryDeploymentEvent.of(CanaryDeploymentEvent.Type.DELETED, deleted, actor));
    }

    // ==================== Queries ====================

    /**
     * Dry-run verdict for the given snapshot; nothing is recorded.
     */
    public HealthVerdict analyze(String id, MetricsSnapshot snapshot) {
        return analyzer.analyze(HealthThresholds.from(getDeployment(id)), snapshot);
    }

    public CanaryDeployment getDeployment(String id) {
        return load(id);
    }

    public List<CanaryDeployment> listDeployments(DeploymentStatus status, int limit) {
        return store.listDeployments(status, limit);
    }

    public List<DeploymentStep> getSteps(String id) {
        load(id);
        return store.findSteps(id);
    }

    public List<RollbackRecord> getRollbackHistory(String id) {
        load(id);
        return rollbackManager.getRollbackHistory(id);
    }

    public List<CanaryMetricSample> getMetricSamples(String id, int limit) {
        load(id);
        return store.findMetricSamples(id, limit);
    }

    public List<CanaryDeployment> findActive() {
        return store.findByStatusIn(List.of(DeploymentStatus.INITIALIZING, DeploymentStatus.PROGRESSING));
    }

    // ==================== Internals ====================

    private RolloutDecision mutate(String id,
                                   BiFunction<CanaryDeployment, List<CanaryDeploymentEvent>, RolloutDecision> work) {
        List<CanaryDeploymentEvent> events = new ArrayList<>();
        RolloutDecision decision = locks.withLock(id, () -> store.inTransaction(() -> work.apply(load(id), events)));
        events.forEach(eventPublisher::publishEvent);
        return decision;
    }

    private Optional<DeploymentStep> runningStep(List<DeploymentStep> steps) {
        return steps.stream().filter(s -> s.getStatus() == StepStatus.RUNNING).findFirst();
    }

    private CanaryDeployment load(String id) {
        return store.findDeployment(id).orElseThrow(() -> ResourceNotFoundException.deployment(id));
    }

    private RolloutDecision resumeLocked(CanaryDeployment deployment, String actor,
                                         List<CanaryDeploymentEvent> events) {
        Instant now = Instant.now();
        DeploymentStatus resumeTo = deployment.getPausedFromStatus();
        if (resumeTo == null || resumeTo == DeploymentStatus.PENDING) {
            // Paused before the first start: nothing was running yet
            deployment.setStatus(DeploymentStatus.PENDING);
            deployment.setPausedFromStatus(null);
            deployment.setStatusMessage("Deployment resumed");
            touch(deployment, now);
            events.add(CanaryDeploymentEvent.of(CanaryDeploymentEvent.Type.RESUMED, deployment, actor));
            return RolloutDecision.unchanged(deployment);
        }

        List<DeploymentStep> steps = store.findSteps(deployment.getId());
        DeploymentStep step = steps.stream()
                .filter(s -> s.getTargetPercent() == deployment.getCurrentCanaryPercent())
                .filter(s -> s.getStatus() == StepStatus.PENDING)
                .findFirst()
                .orElseGet(() -> steps.stream()
                        .filter(s -> s.getStatus() == StepStatus.PENDING)
                        .findFirst()
                        .orElseThrow(() -> new IllegalTransitionException(deployment.getId(),
                                deployment.getStatus(), "resume")));
        step.setStatus(StepStatus.RUNNING);
        if (step.getStartedAt() == null) {
            step.setStartedAt(now);
        }
        store.saveStep(step);

        deployment.setStatus(resumeTo);
        deployment.setPausedFromStatus(null);
        deployment.setCurrentCanaryPercent(step.getTargetPercent());
        deployment.setLastProgressAt(now);
        deployment.setStatusMessage("Deployment resumed");
        touch(deployment, now);

        log.info("Resumed deployment {} at {}%", deployment.getId(), step.getTargetPercent());
        events.add(CanaryDeploymentEvent.of(CanaryDeploymentEvent.Type.RESUMED, deployment, actor));
        return RolloutDecision.of(deployment, TrafficAction.applySplit(step.getTargetPercent()));
    }

    /**
     * Completes the running step and starts the next one. Advancing onto the final step
     * promotes directly, as does completing a single-step plan.
     */
    private TrafficAction advance(CanaryDeployment deployment, List<DeploymentStep> steps, DeploymentStep current,
                                  Instant now, String actor, List<CanaryDeploymentEvent> events) {
        current.setStatus(StepStatus.COMPLETED);
        current.setCompletedAt(now);
        store.saveStep(current);

        Optional<DeploymentStep> next = steps.stream()
                .filter(s -> s.getStepNumber() == current.getStepNumber() + 1)
                .findFirst();

        boolean nextIsFinal = next.isPresent() && next.get().getStepNumber() == steps.size();
        if (next.isPresent() && !nextIsFinal) {
            DeploymentStep step = next.get();
            step.setStatus(StepStatus.RUNNING);
            step.setStartedAt(now);
            store.saveStep(step);

            deployment.setStatus(DeploymentStatus.PROGRESSING);
            deployment.setCurrentCanaryPercent(step.getTargetPercent());
            deployment.setLastProgressAt(now);
            deployment.setStatusMessage("Progressed to " + step.getTargetPercent() + "%");
            touch(deployment, now);

            log.info("Deployment {} progressed to step {} at {}%", deployment.getId(),
                    step.getStepNumber(), step.getTargetPercent());
            events.add(CanaryDeploymentEvent.of(CanaryDeploymentEvent.Type.PROGRESSED, deployment, actor));
            return TrafficAction.applySplit(step.getTargetPercent());
        }

        // Reaching the target step concludes the rollout
        next.ifPresent(last -> {
            last.setStatus(StepStatus.COMPLETED);
            last.setStartedAt(now);
            last.setCompletedAt(now);
            store.saveStep(last);
        });
        markPromoted(deployment, now);
        log.info("Deployment {} completed all {} steps and was promoted", deployment.getId(), steps.size());
        events.add(CanaryDeploymentEvent.of(CanaryDeploymentEvent.Type.PROMOTED, deployment, actor));
        return TrafficAction.promote();
    }

    private void markPromoted(CanaryDeployment deployment, Instant now) {
        deployment.setStatus(DeploymentStatus.PROMOTED);
        deployment.setPausedFromStatus(null);
        deployment.setCurrentCanaryPercent(100);
        deployment.setStatusMessage("Canary successfully promoted to stable");
        deployment.setLastProgressAt(now);
        deployment.setCompletedAt(now);
        touch(deployment, now);
    }

    private void touch(CanaryDeployment deployment, Instant now) {
        deployment.setUpdatedAt(now);
        store.saveDeployment(deployment);
    }

    private MetricsSnapshot collect(MetricsSource source, CanaryDeployment deployment, DeploymentStep step) {
        if (source == null) {
            return null;
        }
        try {
            return source.collect(deployment, step).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Metrics source failed for deployment {}: {}", deployment.getId(), e.getMessage());
            return null;
        }
    }

    private CanaryMetricSample toSample(CanaryDeployment deployment, DeploymentStep step,
                                        HealthVerdict verdict, Instant now) {
        CanaryMetricSample.CanaryMetricSampleBuilder builder = CanaryMetricSample.builder()
                .deploymentId(deployment.getId())
                .stepId(step.getId())
                .stepNumber(step.getStepNumber())
                .canaryPercent(deployment.getCurrentCanaryPercent())
                .metricsAvailable(verdict.isMetricsAvailable())
                .analysisResult(verdict.getAnalysisResult().name())
                .analysisNotes(String.join("; ", verdict.getReasons()))
                .sampledAt(now);
        MetricsSnapshot m = verdict.getMetrics();
        if (m != null) {
            builder.canaryErrorRate(m.getCanaryErrorRate())
                    .stableErrorRate(m.getStableErrorRate())
                    .canaryAvgLatencyMs(m.getCanaryAvgLatencyMs())
                    .stableAvgLatencyMs(m.getStableAvgLatencyMs())
                    .canaryRequests(m.getCanaryRequests())
                    .stableRequests(m.getStableRequests())
                    .canaryHealthyPods(m.getCanaryHealthyPods())
                    .canaryTotalPods(m.getCanaryTotalPods());
        }
        return builder.build();
    }

    static RollbackRecord.Trigger triggerFor(Set<HealthVerdict.HealthDimension> dimensions) {
        if (dimensions.size() != 1) {
            return RollbackRecord.Trigger.AUTO_HEALTH_CHECK;
        }
        return switch (dimensions.iterator().next()) {
            case ERROR_RATE -> RollbackRecord.Trigger.AUTO_ERROR_RATE;
            case LATENCY -> RollbackRecord.Trigger.AUTO_LATENCY;
            case POD_HEALTH -> RollbackRecord.Trigger.AUTO_POD_FAILURE;
        };
    }

    private String outcome(RolloutDecision decision) {
        if (decision.verdict() == null) {
            return "skipped";
        }
        return switch (decision.action().type()) {
            case APPLY_SPLIT -> "progressed";
            case PROMOTE -> "promoted";
            case REVERT_TO_STABLE -> "rollback";
            case NONE -> "hold";
        };
    }

    private void requestAdvice(RolloutDecision decision) {
        HealthVerdict verdict = decision.verdict();
        if (verdict == null || !verdict.getAnalysisResult().needsAdvice()) {
            return;
        }
        CanaryDeployment deployment = decision.deployment();
        advisoryDispatcher.dispatch(AdvisoryRequest.builder()
                .deploymentId(deployment.getId())
                .deploymentName(deployment.getName())
                .namespace(deployment.getNamespace())
                .targetDeployment(deployment.getTargetDeployment())
                .canaryImage(deployment.getCanaryImage())
                .canaryVersion(deployment.getCanaryVersion())
                .stableVersion(deployment.getStableVersion())
                .currentCanaryPercent(deployment.getCurrentCanaryPercent())
                .sampleId(decision.sampleId())
                .verdict(verdict)
                .thresholds(HealthThresholds.from(deployment))
                .build());
    }
}
