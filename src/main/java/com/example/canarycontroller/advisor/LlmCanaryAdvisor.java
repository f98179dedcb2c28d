package com.example.canarycontroller.advisor;

import com.example.canarycontroller.analysis.HealthThresholds;
import com.example.canarycontroller.analysis.MetricsSnapshot;
import com.example.canarycontroller.canary.AdvisoryRequest;
import com.example.canarycontroller.canary.CanaryAdvisor;
import com.example.canarycontroller.config.CanaryProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Asks an LLM for a short rollback / pause / continue recommendation on a struggling canary.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmCanaryAdvisor implements CanaryAdvisor {

    static final String SYSTEM_PROMPT =
            "You are a DevOps expert analyzing canary deployments. Be concise and actionable.";

    private final LlmClient llmClient;
    private final CanaryProperties properties;

    @Override
    public Optional<String> advise(AdvisoryRequest request) throws IOException {
        CanaryProperties.AdvisorConfig config = properties.getAdvisor();
        if (!config.isEnabled() || config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.debug("LLM advisor not configured, no advice for deployment {}", request.getDeploymentId());
            return Optional.empty();
        }
        return llmClient.complete(List.of(
                ChatMessage.system(SYSTEM_PROMPT),
                ChatMessage.user(buildPrompt(request))));
    }

    String buildPrompt(AdvisoryRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("Analyze this canary deployment and provide a brief recommendation:\n\n");
        sb.append("Deployment: ").append(request.getDeploymentName()).append("\n");
        sb.append("Target: ").append(request.getNamespace()).append("/").append(request.getTargetDeployment()).append("\n");
        sb.append("Current Traffic: ").append(request.getCurrentCanaryPercent()).append("%\n");
        sb.append("Canary Image: ").append(request.getCanaryImage()).append("\n");
        if (request.getCanaryVersion() != null) {
            sb.append("Canary Version: ").append(request.getCanaryVersion()).append("\n");
        }
        if (request.getStableVersion() != null) {
            sb.append("Stable Version: ").append(request.getStableVersion()).append("\n");
        }

        MetricsSnapshot m = request.getVerdict().getMetrics();
        if (m != null) {
            sb.append("\nMetrics:\n");
            sb.append(String.format(Locale.ROOT, "- Canary Error Rate: %.2f%%%n", m.getCanaryErrorRate()));
            sb.append(String.format(Locale.ROOT, "- Stable Error Rate: %.2f%%%n", m.getStableErrorRate()));
            sb.append(String.format(Locale.ROOT, "- Canary Latency: %.0fms%n", m.getCanaryAvgLatencyMs()));
            sb.append(String.format(Locale.ROOT, "- Stable Latency: %.0fms%n", m.getStableAvgLatencyMs()));
            sb.append(String.format(Locale.ROOT, "- Healthy Pods: %d/%d%n", m.getCanaryHealthyPods(), m.getCanaryTotalPods()));
        }

        sb.append("\nIssues: ").append(String.join(", ", request.getVerdict().getReasons())).append("\n");

        HealthThresholds t = request.getThresholds();
        sb.append("\nThresholds:\n");
        sb.append("- Error Rate: ").append(t.getErrorRateThreshold()).append("%\n");
        sb.append("- Latency: ").append(t.getLatencyThresholdMs()).append("ms\n");
        sb.append("- Min Healthy Pods: ").append(t.getMinHealthyPods()).append("\n");

        sb.append("\nProvide a brief (2-3 sentences) recommendation on whether to rollback, pause, or continue the deployment.");
        return sb.toString();
    }
}
