package com.example.canarycontroller.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of one health evaluation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthVerdict {

    /** Null when no metrics were available */
    private MetricsSnapshot metrics;

    private boolean healthy;
    private boolean shouldRollback;
    private boolean shouldPromote;
    private AnalysisResult analysisResult;

    @Builder.Default
    private List<String> reasons = new ArrayList<>();

    /** Dimensions whose violation requested the rollback */
    @Builder.Default
    private Set<HealthDimension> rollbackDimensions = EnumSet.noneOf(HealthDimension.class);

    public enum AnalysisResult {
        HEALTHY, DEGRADED, UNHEALTHY, INCONCLUSIVE;

        /** Results worth an advisor narrative */
        public boolean needsAdvice() {
            return this == DEGRADED || this == UNHEALTHY;
        }
    }

    public enum HealthDimension {
        ERROR_RATE, LATENCY, POD_HEALTH
    }

    public boolean isMetricsAvailable() {
        return metrics != null;
    }

    public static HealthVerdict inconclusive(String reason) {
        return HealthVerdict.builder()
                .healthy(false)
                .shouldRollback(false)
                .shouldPromote(false)
                .analysisResult(AnalysisResult.INCONCLUSIVE)
                .reasons(new ArrayList<>(List.of(reason)))
                .build();
    }
}
