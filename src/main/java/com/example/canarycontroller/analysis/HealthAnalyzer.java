package com.example.canarycontroller.analysis;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Health Analyzer - turns a metrics snapshot and the deployment's thresholds
 * into a promote / rollback / hold verdict.
 *
 * Each dimension is checked independently and every violation is reported:
 * - Canary error rate above threshold
 * - Canary average latency above threshold
 * - Healthy canary pods below the minimum
 *
 * Promotion only looks at the success rate derived from the canary error rate;
 * the pod minimum is not re-checked at that point.
 *
 * Performs no I/O and never throws. A missing snapshot, or one without a canary error rate,
 * latency or healthy pod count, yields INCONCLUSIVE.
 */
@Component
public class HealthAnalyzer {

    static final String METRICS_UNAVAILABLE = "Metrics unavailable for canary evaluation";

    public HealthVerdict analyze(HealthThresholds thresholds, MetricsSnapshot metrics) {
        if (metrics == null) {
            return HealthVerdict.inconclusive(METRICS_UNAVAILABLE);
        }
        List<String> missing = metrics.missingCanaryFields();
        if (!missing.isEmpty()) {
            return HealthVerdict.inconclusive("Incomplete metrics, missing " + String.join(", ", missing));
        }

        List<String> reasons = new ArrayList<>();
        Set<HealthVerdict.HealthDimension> rollbackDimensions = EnumSet.noneOf(HealthVerdict.HealthDimension.class);
        boolean healthy = true;
        boolean autoRollback = thresholds.isAutoRollbackEnabled();

        if (metrics.getCanaryErrorRate() > thresholds.getErrorRateThreshold()) {
            healthy = false;
            reasons.add(String.format(Locale.ROOT, "Error rate %.2f%% exceeds threshold %s%%",
                    metrics.getCanaryErrorRate(), format(thresholds.getErrorRateThreshold())));
            if (thresholds.isRollbackOnErrorRate() && autoRollback) {
                rollbackDimensions.add(HealthVerdict.HealthDimension.ERROR_RATE);
            }
        }

        if (metrics.getCanaryAvgLatencyMs() > thresholds.getLatencyThresholdMs()) {
            healthy = false;
            reasons.add(String.format(Locale.ROOT, "Latency %.0fms exceeds threshold %dms",
                    metrics.getCanaryAvgLatencyMs(), thresholds.getLatencyThresholdMs()));
            if (thresholds.isRollbackOnLatency() && autoRollback) {
                rollbackDimensions.add(HealthVerdict.HealthDimension.LATENCY);
            }
        }

        if (metrics.getCanaryHealthyPods() < thresholds.getMinHealthyPods()) {
            healthy = false;
            reasons.add(String.format(Locale.ROOT, "Healthy pods %d below minimum %d",
                    metrics.getCanaryHealthyPods(), thresholds.getMinHealthyPods()));
            if (thresholds.isRollbackOnPodFailure() && autoRollback) {
                rollbackDimensions.add(HealthVerdict.HealthDimension.POD_HEALTH);
            }
        }

        boolean shouldRollback = !rollbackDimensions.isEmpty();
        boolean shouldPromote = false;
        if (healthy && !shouldRollback) {
            double successRate = 100.0 - metrics.getCanaryErrorRate();
            if (successRate >= thresholds.getSuccessRateThreshold()) {
                shouldPromote = true;
                reasons.add(String.format(Locale.ROOT, "Success rate %.2f%% meets threshold %s%%",
                        successRate, format(thresholds.getSuccessRateThreshold())));
            } else {
                reasons.add(String.format(Locale.ROOT, "Success rate %.2f%% below threshold %s%%",
                        successRate, format(thresholds.getSuccessRateThreshold())));
            }
        }

        return HealthVerdict.builder()
                .metrics(metrics)
                .healthy(healthy)
                .shouldRollback(shouldRollback)
                .shouldPromote(shouldPromote)
                .analysisResult(classify(healthy, shouldRollback, shouldPromote))
                .reasons(reasons)
                .rollbackDimensions(rollbackDimensions)
                .build();
    }

    private HealthVerdict.AnalysisResult classify(boolean healthy, boolean shouldRollback, boolean shouldPromote) {
        if (shouldRollback) return HealthVerdict.AnalysisResult.UNHEALTHY;
        if (healthy && shouldPromote) return HealthVerdict.AnalysisResult.HEALTHY;
        if (!healthy) return HealthVerdict.AnalysisResult.DEGRADED;
        return HealthVerdict.AnalysisResult.INCONCLUSIVE;
    }

    private String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
