package com.example.canarycontroller.controller;

import com.example.canarycontroller.analysis.HealthVerdict;
import com.example.canarycontroller.analysis.MetricsSnapshot;
import com.example.canarycontroller.canary.CanaryDeploymentRequest;
import com.example.canarycontroller.canary.CanaryOrchestrator;
import com.example.canarycontroller.canary.RolloutDecision;
import com.example.canarycontroller.domain.CanaryDeployment;
import com.example.canarycontroller.domain.CanaryMetricSample;
import com.example.canarycontroller.domain.DeploymentStep;
import com.example.canarycontroller.domain.RollbackRecord;
import com.example.canarycontroller.error.IllegalTransitionException;
import com.example.canarycontroller.error.InvalidConfigurationException;
import com.example.canarycontroller.integration.PushedMetricsSource;
import com.example.canarycontroller.service.RolloutDriver;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canary Deployment REST API Controller.
 */
@RestController
@RequestMapping("/api/canary")
@RequiredArgsConstructor
public class CanaryController {

    static final String ACTOR_HEADER = "X-Actor";

    private final CanaryOrchestrator orchestrator;
    private final RolloutDriver driver;
    private final PushedMetricsSource metricsSource;

    @PostMapping
    public ResponseEntity<CanaryDeployment> create(@RequestBody CanaryDeploymentRequest request,
                                                   @RequestHeader(value = ACTOR_HEADER, defaultValue = "api") String actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(orchestrator.create(request, actor));
    }

    @GetMapping
    public ResponseEntity<List<CanaryDeployment>> list(@RequestParam(required = false) String status,
                                                       @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(orchestrator.listDeployments(parseStatus(status), limit));
    }

    @GetMapping("/{id}")
    public ResponseEntity<CanaryDeployment> get(@PathVariable String id) {
        return ResponseEntity.ok(orchestrator.getDeployment(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String id,
                                                      @RequestHeader(value = ACTOR_HEADER, defaultValue = "api") String actor) {
        orchestrator.delete(id, actor);
        return ResponseEntity.ok(Map.of("deleted", true, "id", id));
    }

    @GetMapping("/{id}/steps")
    public ResponseEntity<List<DeploymentStep>> steps(@PathVariable String id) {
        return ResponseEntity.ok(orchestrator.getSteps(id));
    }

    // ==================== Rollout control ====================

    @PostMapping("/{id}/start")
    public ResponseEntity<Map<String, Object>> start(@PathVariable String id,
                                                     @RequestHeader(value = ACTOR_HEADER, defaultValue = "api") String actor) {
        return ResponseEntity.ok(toBody(driver.start(id, actor)));
    }

    /**
     * Push the latest canary/stable metrics; consumed by the next tick.
     */
    @PostMapping("/{id}/metrics")
    public ResponseEntity<Map<String, Object>> pushMetrics(@PathVariable String id,
                                                           @RequestBody MetricsSnapshot snapshot) {
        CanaryDeployment deployment = orchestrator.getDeployment(id);
        if (deployment.isTerminal()) {
            throw new IllegalTransitionException(id, deployment.getStatus(), "push metrics for");
        }
        metricsSource.push(id, snapshot);
        return ResponseEntity.accepted().body(Map.of("deploymentId", id, "accepted", true));
    }

    /**
     * Run one evaluation cycle. A snapshot in the body is pushed first.
     */
    @PostMapping("/{id}/tick")
    public ResponseEntity<Map<String, Object>> tick(@PathVariable String id,
                                                    @RequestBody(required = false) MetricsSnapshot snapshot) {
        if (snapshot != null && !orchestrator.getDeployment(id).isTerminal()) {
            metricsSource.push(id, snapshot);
        }
        return ResponseEntity.ok(toBody(driver.tick(id)));
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<CanaryDeployment> pause(@PathVariable String id,
                                                  @RequestHeader(value = ACTOR_HEADER, defaultValue = "api") String actor) {
        return ResponseEntity.ok(orchestrator.pause(id, actor));
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<Map<String, Object>> resume(@PathVariable String id,
                                                      @RequestHeader(value = ACTOR_HEADER, defaultValue = "api") String actor) {
        return ResponseEntity.ok(toBody(driver.resume(id, actor)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<CanaryDeployment> cancel(@PathVariable String id,
                                                   @RequestHeader(value = ACTOR_HEADER, defaultValue = "api") String actor) {
        return ResponseEntity.ok(orchestrator.cancel(id, actor));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<CanaryDeployment> approve(@PathVariable String id,
                                                    @RequestHeader(value = ACTOR_HEADER, defaultValue = "api") String actor) {
        return ResponseEntity.ok(orchestrator.approve(id, actor));
    }

    @PostMapping("/{id}/promote")
    public ResponseEntity<Map<String, Object>> promote(@PathVariable String id,
                                                       @RequestHeader(value = ACTOR_HEADER, defaultValue = "api") String actor) {
        return ResponseEntity.ok(toBody(driver.promoteNow(id, actor)));
    }

    @PostMapping("/{id}/promote-to-stable")
    public ResponseEntity<Map<String, Object>> promoteToStable(@PathVariable String id,
                                                               @RequestHeader(value = ACTOR_HEADER, defaultValue = "api") String actor) {
        return ResponseEntity.ok(toBody(driver.promoteToStable(id, actor)));
    }

    @PostMapping("/{id}/rollback")
    public ResponseEntity<Map<String, Object>> rollback(@PathVariable String id,
                                                        @RequestBody(required = false) Map<String, String> body,
                                                        @RequestHeader(value = ACTOR_HEADER, defaultValue = "api") String actor) {
        String reason = body != null ? body.get("reason") : null;
        return ResponseEntity.ok(toBody(driver.rollbackNow(id, reason, actor)));
    }

    /**
     * Explicit failure signal from an external executor that could not apply a split.
     */
    @PostMapping("/{id}/failure")
    public ResponseEntity<CanaryDeployment> reportFailure(@PathVariable String id,
                                                          @RequestBody(required = false) Map<String, String> body) {
        String message = body != null && body.get("message") != null ? body.get("message") : "Execution failed";
        return ResponseEntity.ok(orchestrator.reportExecutionFailure(id, message));
    }

    // ==================== Rollbacks & metrics ====================

    @GetMapping("/{id}/rollbacks")
    public ResponseEntity<List<RollbackRecord>> rollbacks(@PathVariable String id) {
        return ResponseEntity.ok(orchestrator.getRollbackHistory(id));
    }

    @PostMapping("/rollbacks/{rollbackId}/complete")
    public ResponseEntity<RollbackRecord> completeRollback(@PathVariable String rollbackId,
                                                           @RequestBody Map<String, Object> body) {
        Object success = body.get("success");
        if (!(success instanceof Boolean)) {
            throw new InvalidConfigurationException("success", success, "must be true or false");
        }
        Object error = body.get("errorMessage");
        return ResponseEntity.ok(orchestrator.completeRollback(rollbackId, (Boolean) success,
                error != null ? error.toString() : null));
    }

    @GetMapping("/{id}/metrics")
    public ResponseEntity<List<CanaryMetricSample>> metrics(@PathVariable String id,
                                                            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(orchestrator.getMetricSamples(id, limit));
    }

    /**
     * Dry-run analysis of a snapshot against the deployment's thresholds.
     */
    @PostMapping("/{id}/analyze")
    public ResponseEntity<HealthVerdict> analyze(@PathVariable String id,
                                                 @RequestBody(required = false) MetricsSnapshot snapshot) {
        return ResponseEntity.ok(orchestrator.analyze(id, snapshot));
    }

    private CanaryDeployment.DeploymentStatus parseStatus(String status) {
        if (status == null || status.isBlank()) return null;
        try {
            return CanaryDeployment.DeploymentStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("status", status, "unknown deployment status");
        }
    }

    private Map<String, Object> toBody(RolloutDecision decision) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("deployment", decision.deployment());
        body.put("action", decision.action().type());
        body.put("canaryPercent", decision.deployment().getCurrentCanaryPercent());
        if (decision.verdict() != null) body.put("analysis", decision.verdict());
        if (decision.rollback() != null) body.put("rollbackId", decision.rollback().getId());
        if (decision.sampleId() != null) body.put("sampleId", decision.sampleId());
        return body;
    }
}
