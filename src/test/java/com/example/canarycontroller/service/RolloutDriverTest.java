package com.example.canarycontroller.service;

import com.example.canarycontroller.canary.CanaryDeploymentEvent;
import com.example.canarycontroller.canary.CanaryDeploymentRequest;
import com.example.canarycontroller.canary.RolloutDecision;
import com.example.canarycontroller.canary.TrafficAction;
import com.example.canarycontroller.canary.WorkloadController;
import com.example.canarycontroller.domain.CanaryDeployment;
import com.example.canarycontroller.domain.CanaryDeployment.DeploymentStatus;
import com.example.canarycontroller.domain.RollbackRecord;
import com.example.canarycontroller.integration.PushedMetricsSource;
import com.example.canarycontroller.support.EngineFixture;
import com.example.canarycontroller.support.Snapshots;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RolloutDriverTest {

    private EngineFixture fixture;
    private WorkloadController workload;
    private PushedMetricsSource metrics;
    private RolloutDriver driver;
    private String deploymentId;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        workload = mock(WorkloadController.class);
        metrics = new PushedMetricsSource();
        driver = new RolloutDriver(fixture.orchestrator, workload, metrics, fixture.properties);
        CanaryDeploymentRequest request = EngineFixture.request();
        request.setIncrementPercent(30);
        deploymentId = fixture.orchestrator.create(request, "alice").getId();
    }

    @Test
    void startAppliesInitialSplit() throws Exception {
        RolloutDecision decision = driver.start(deploymentId, "alice");

        assertEquals(TrafficAction.Type.APPLY_SPLIT, decision.action().type());
        verify(workload).applyTrafficSplit(any(CanaryDeployment.class), eq(10));
        assertEquals(DeploymentStatus.INITIALIZING, decision.deployment().getStatus());
    }

    @Test
    void healthyTicksDriveTrafficToPromotion() throws Exception {
        driver.start(deploymentId, "alice");
        RolloutDecision decision = null;
        for (int i = 0; i < 3; i++) {
            metrics.push(deploymentId, Snapshots.healthy());
            decision = driver.tick(deploymentId);
        }

        assertEquals(DeploymentStatus.PROMOTED, decision.deployment().getStatus());
        verify(workload).applyTrafficSplit(any(CanaryDeployment.class), eq(40));
        verify(workload).applyTrafficSplit(any(CanaryDeployment.class), eq(70));
        verify(workload).applyTrafficSplit(any(CanaryDeployment.class), eq(100));
    }

    @Test
    void tickWithoutPushedMetricsHolds() throws Exception {
        driver.start(deploymentId, "alice");

        RolloutDecision decision = driver.tick(deploymentId);

        assertTrue(decision.action().isNone());
        verify(workload, times(1)).applyTrafficSplit(any(CanaryDeployment.class), anyInt());
    }

    @Test
    void workloadFailureFailsDeployment() throws Exception {
        doThrow(new IllegalStateException("image pull backoff"))
                .when(workload).applyTrafficSplit(any(CanaryDeployment.class), anyInt());

        RolloutDecision decision = driver.start(deploymentId, "alice");

        assertEquals(DeploymentStatus.FAILED, decision.deployment().getStatus());
        assertEquals("Execution failed: image pull backoff", decision.deployment().getStatusMessage());
        assertTrue(fixture.eventTypes().contains(CanaryDeploymentEvent.Type.FAILED));
    }

    @Test
    void unhealthyTickRevertsAndCompletesRollback() throws Exception {
        driver.start(deploymentId, "alice");
        metrics.push(deploymentId, Snapshots.erroring(20.0));

        RolloutDecision decision = driver.tick(deploymentId);

        verify(workload).revertToStable(any(CanaryDeployment.class));
        assertEquals(DeploymentStatus.ROLLED_BACK, decision.deployment().getStatus());
        assertEquals(0, decision.deployment().getCurrentCanaryPercent());
        RollbackRecord rollback = fixture.orchestrator.getRollbackHistory(deploymentId).get(0);
        assertEquals(RollbackRecord.RollbackStatus.COMPLETED, rollback.getStatus());
        assertEquals(RollbackRecord.Trigger.AUTO_ERROR_RATE, rollback.getTrigger());
    }

    @Test
    void failedRevertFailsRollbackAndDeployment() throws Exception {
        driver.start(deploymentId, "alice");
        doThrow(new IllegalStateException("api server unreachable"))
                .when(workload).revertToStable(any(CanaryDeployment.class));

        RolloutDecision decision = driver.rollbackNow(deploymentId, "bad release", "ops");

        assertEquals(DeploymentStatus.FAILED, decision.deployment().getStatus());
        assertEquals(10, decision.deployment().getCurrentCanaryPercent());
        RollbackRecord rollback = fixture.orchestrator.getRollbackHistory(deploymentId).get(0);
        assertEquals(RollbackRecord.RollbackStatus.FAILED, rollback.getStatus());
        assertEquals("api server unreachable", rollback.getErrorMessage());
        assertEquals("bad release", rollback.getReason());
    }

    @Test
    void pollingIsGatedByConfiguration() {
        driver.start(deploymentId, "alice");
        metrics.push(deploymentId, Snapshots.healthy());

        driver.pollActiveDeployments();

        assertTrue(metrics.hasPending(deploymentId));
    }

    @Test
    void pollingTicksOnlyDueDeployments() {
        fixture.properties.getDriver().setEnabled(true);
        driver.start(deploymentId, "alice");
        metrics.push(deploymentId, Snapshots.healthy());

        driver.pollActiveDeployments();

        // Interval of five minutes has not elapsed since start
        assertTrue(metrics.hasPending(deploymentId));
        assertEquals(10, fixture.orchestrator.getDeployment(deploymentId).getCurrentCanaryPercent());
    }

    @Test
    void dueWhenIntervalElapsedSinceLastProgress() {
        Instant now = Instant.now();
        CanaryDeployment deployment = CanaryDeployment.builder()
                .incrementIntervalMinutes(5)
                .startedAt(now.minus(Duration.ofMinutes(20)))
                .lastProgressAt(now.minus(Duration.ofMinutes(3)))
                .build();

        assertFalse(driver.isDue(deployment, now));
        assertTrue(driver.isDue(deployment, now.plus(Duration.ofMinutes(2))));
        deployment.setLastProgressAt(null);
        assertTrue(driver.isDue(deployment, now));
    }
}
