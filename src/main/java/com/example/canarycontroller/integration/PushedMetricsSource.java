package com.example.canarycontroller.integration;

import com.example.canarycontroller.analysis.MetricsSnapshot;
import com.example.canarycontroller.canary.CanaryDeploymentEvent;
import com.example.canarycontroller.canary.MetricsSource;
import com.example.canarycontroller.domain.CanaryDeployment;
import com.example.canarycontroller.domain.DeploymentStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metrics pushed by an external collector (CI job, monitoring bridge) through the API.
 * Each pushed snapshot is consumed by the next tick, so repeating a tick without a new
 * push sees no metrics. Unconsumed snapshots are dropped once the deployment finishes
 * or is deleted.
 */
@Slf4j
@Component
public class PushedMetricsSource implements MetricsSource {

    private final Map<String, MetricsSnapshot> latest = new ConcurrentHashMap<>();

    public void push(String deploymentId, MetricsSnapshot snapshot) {
        if (latest.put(deploymentId, snapshot) != null) {
            log.debug("Replaced unconsumed metrics for deployment {}", deploymentId);
        }
    }

    @Override
    public Optional<MetricsSnapshot> collect(CanaryDeployment deployment, DeploymentStep runningStep) {
        return Optional.ofNullable(latest.remove(deployment.getId()));
    }

    public boolean hasPending(String deploymentId) {
        return latest.containsKey(deploymentId);
    }

    public void discard(String deploymentId) {
        if (latest.remove(deploymentId) != null) {
            log.debug("Dropped unconsumed metrics for deployment {}", deploymentId);
        }
    }

    @EventListener
    public void onDeploymentEvent(CanaryDeploymentEvent event) {
        boolean finished = event.type() == CanaryDeploymentEvent.Type.DELETED
                || (event.status() != null && event.status().isTerminal());
        if (finished) {
            discard(event.deploymentId());
        }
    }
}
