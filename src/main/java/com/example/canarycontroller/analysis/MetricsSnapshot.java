package com.example.canarycontroller.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Canary vs stable metrics observed for one evaluation. Rates are percentages.
 * Fields left null were not reported by the collector.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsSnapshot {

    private Double canaryErrorRate;
    private Double stableErrorRate;
    private Double canaryAvgLatencyMs;
    private Double stableAvgLatencyMs;
    private Integer canaryHealthyPods;
    private Integer canaryTotalPods;

    private Long canaryRequests;
    private Long stableRequests;

    /**
     * @return names of the canary fields the analyzer needs but the collector left out
     */
    public List<String> missingCanaryFields() {
        List<String> missing = new ArrayList<>();
        if (canaryErrorRate == null) missing.add("canaryErrorRate");
        if (canaryAvgLatencyMs == null) missing.add("canaryAvgLatencyMs");
        if (canaryHealthyPods == null) missing.add("canaryHealthyPods");
        return missing;
    }
}
