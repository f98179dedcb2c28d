package com.example.canarycontroller.analysis;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class HealthAnalyzerTest {

    private final HealthAnalyzer analyzer = new HealthAnalyzer();

    private HealthThresholds.HealthThresholdsBuilder thresholds() {
        return HealthThresholds.builder()
                .errorRateThreshold(5)
                .latencyThresholdMs(1000)
                .successRateThreshold(95)
                .minHealthyPods(1)
                .autoRollbackEnabled(true)
                .rollbackOnErrorRate(true)
                .rollbackOnLatency(true)
                .rollbackOnPodFailure(true);
    }

    private MetricsSnapshot.MetricsSnapshotBuilder snapshot() {
        return MetricsSnapshot.builder()
                .canaryErrorRate(1.0)
                .stableErrorRate(1.0)
                .canaryAvgLatencyMs(200.0)
                .stableAvgLatencyMs(200.0)
                .canaryHealthyPods(3)
                .canaryTotalPods(3);
    }

    @Test
    void errorRateAboveThresholdRollsBack() {
        HealthVerdict verdict = analyzer.analyze(thresholds().build(), snapshot().canaryErrorRate(7.0).build());

        assertTrue(verdict.isShouldRollback());
        assertFalse(verdict.isShouldPromote());
        assertFalse(verdict.isHealthy());
        assertEquals(HealthVerdict.AnalysisResult.UNHEALTHY, verdict.getAnalysisResult());
        assertEquals(EnumSet.of(HealthVerdict.HealthDimension.ERROR_RATE), verdict.getRollbackDimensions());
        assertEquals("Error rate 7.00% exceeds threshold 5%", verdict.getReasons().get(0));
    }

    @Test
    void successRateAboveThresholdPromotes() {
        HealthVerdict verdict = analyzer.analyze(thresholds().build(), snapshot().canaryErrorRate(2.0).build());

        assertTrue(verdict.isHealthy());
        assertTrue(verdict.isShouldPromote());
        assertFalse(verdict.isShouldRollback());
        assertEquals(HealthVerdict.AnalysisResult.HEALTHY, verdict.getAnalysisResult());
    }

    @Test
    void everyViolationIsReported() {
        HealthVerdict verdict = analyzer.analyze(thresholds().build(), snapshot()
                .canaryErrorRate(9.0)
                .canaryAvgLatencyMs(2500.0)
                .canaryHealthyPods(0)
                .build());

        assertEquals(3, verdict.getReasons().size());
        assertEquals(EnumSet.allOf(HealthVerdict.HealthDimension.class), verdict.getRollbackDimensions());
        assertTrue(verdict.getReasons().get(1).startsWith("Latency 2500ms exceeds threshold 1000ms"));
        assertEquals("Healthy pods 0 below minimum 1", verdict.getReasons().get(2));
    }

    @Test
    void violationWithoutAutoRollbackIsDegraded() {
        HealthVerdict verdict = analyzer.analyze(thresholds().autoRollbackEnabled(false).build(),
                snapshot().canaryErrorRate(7.0).build());

        assertFalse(verdict.isShouldRollback());
        assertFalse(verdict.isShouldPromote());
        assertEquals(HealthVerdict.AnalysisResult.DEGRADED, verdict.getAnalysisResult());
    }

    @Test
    void perDimensionFlagControlsRollback() {
        HealthVerdict verdict = analyzer.analyze(thresholds().rollbackOnLatency(false).build(),
                snapshot().canaryAvgLatencyMs(1500.0).build());

        assertFalse(verdict.isShouldRollback());
        assertEquals(HealthVerdict.AnalysisResult.DEGRADED, verdict.getAnalysisResult());
    }

    @Test
    void healthyButBelowSuccessRateIsInconclusive() {
        HealthVerdict verdict = analyzer.analyze(thresholds().errorRateThreshold(10).successRateThreshold(95).build(),
                snapshot().canaryErrorRate(8.0).build());

        assertTrue(verdict.isHealthy());
        assertFalse(verdict.isShouldPromote());
        assertEquals(HealthVerdict.AnalysisResult.INCONCLUSIVE, verdict.getAnalysisResult());
    }

    @Test
    void missingMetricsAreInconclusiveNeverHealthy() {
        HealthVerdict verdict = analyzer.analyze(thresholds().build(), null);

        assertFalse(verdict.isHealthy());
        assertFalse(verdict.isShouldPromote());
        assertFalse(verdict.isShouldRollback());
        assertFalse(verdict.isMetricsAvailable());
        assertEquals(HealthVerdict.AnalysisResult.INCONCLUSIVE, verdict.getAnalysisResult());
    }

    @Test
    void unreportedPodCountDoesNotTriggerRollback() {
        MetricsSnapshot partial = MetricsSnapshot.builder()
                .canaryErrorRate(1.0)
                .canaryAvgLatencyMs(200.0)
                .build();

        HealthVerdict verdict = analyzer.analyze(thresholds().build(), partial);

        assertFalse(verdict.isShouldRollback());
        assertFalse(verdict.isShouldPromote());
        assertTrue(verdict.getRollbackDimensions().isEmpty());
        assertEquals(HealthVerdict.AnalysisResult.INCONCLUSIVE, verdict.getAnalysisResult());
        assertEquals("Incomplete metrics, missing canaryHealthyPods", verdict.getReasons().get(0));
    }

    @Test
    void everyMissingCanaryFieldIsReported() {
        HealthVerdict verdict = analyzer.analyze(thresholds().build(),
                MetricsSnapshot.builder().stableErrorRate(0.5).build());

        assertEquals(HealthVerdict.AnalysisResult.INCONCLUSIVE, verdict.getAnalysisResult());
        assertEquals("Incomplete metrics, missing canaryErrorRate, canaryAvgLatencyMs, canaryHealthyPods",
                verdict.getReasons().get(0));
    }

    @Test
    void boundaryValuesDoNotViolate() {
        HealthVerdict verdict = analyzer.analyze(thresholds().errorRateThreshold(5).successRateThreshold(95).build(),
                snapshot().canaryErrorRate(5.0).canaryAvgLatencyMs(1000.0).canaryHealthyPods(1).build());

        assertTrue(verdict.isHealthy());
        assertTrue(verdict.isShouldPromote());
    }
}
