package com.example.canarycontroller.support;

import com.example.canarycontroller.canary.DeploymentStore;
import com.example.canarycontroller.domain.CanaryDeployment;
import com.example.canarycontroller.domain.CanaryMetricSample;
import com.example.canarycontroller.domain.DeploymentStep;
import com.example.canarycontroller.domain.RollbackRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Map-backed store for engine unit tests. Entities are kept by reference, as a JPA
 * persistence context would within one transaction.
 */
public class InMemoryDeploymentStore implements DeploymentStore {

    private final Map<String, CanaryDeployment> deployments = new LinkedHashMap<>();
    private final Map<String, DeploymentStep> steps = new LinkedHashMap<>();
    private final Map<String, RollbackRecord> rollbacks = new LinkedHashMap<>();
    private final Map<String, CanaryMetricSample> samples = new LinkedHashMap<>();
    private int transactions;

    @Override
    public synchronized CanaryDeployment saveDeployment(CanaryDeployment deployment) {
        if (deployment.getId() == null) deployment.setId(UUID.randomUUID().toString());
        deployments.put(deployment.getId(), deployment);
        return deployment;
    }

    @Override
    public synchronized Optional<CanaryDeployment> findDeployment(String id) {
        return Optional.ofNullable(deployments.get(id));
    }

    @Override
    public synchronized List<CanaryDeployment> listDeployments(CanaryDeployment.DeploymentStatus status, int limit) {
        List<CanaryDeployment> all = new ArrayList<>(deployments.values());
        Collections.reverse(all);
        return all.stream()
                .filter(d -> status == null || d.getStatus() == status)
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<CanaryDeployment> findByStatusIn(List<CanaryDeployment.DeploymentStatus> statuses) {
        return deployments.values().stream()
                .filter(d -> statuses.contains(d.getStatus()))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void deleteDeployment(String id) {
        deployments.remove(id);
        steps.values().removeIf(s -> id.equals(s.getDeploymentId()));
        rollbacks.values().removeIf(r -> id.equals(r.getDeploymentId()));
        samples.values().removeIf(s -> id.equals(s.getDeploymentId()));
    }

    @Override
    public synchronized DeploymentStep saveStep(DeploymentStep step) {
        if (step.getId() == null) step.setId(UUID.randomUUID().toString());
        steps.put(step.getId(), step);
        return step;
    }

    @Override
    public synchronized List<DeploymentStep> saveSteps(List<DeploymentStep> toSave) {
        toSave.forEach(this::saveStep);
        return toSave;
    }

    @Override
    public synchronized List<DeploymentStep> findSteps(String deploymentId) {
        return steps.values().stream()
                .filter(s -> deploymentId.equals(s.getDeploymentId()))
                .sorted(Comparator.comparingInt(DeploymentStep::getStepNumber))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized RollbackRecord saveRollback(RollbackRecord record) {
        if (record.getId() == null) record.setId(UUID.randomUUID().toString());
        rollbacks.put(record.getId(), record);
        return record;
    }

    @Override
    public synchronized Optional<RollbackRecord> findRollback(String rollbackId) {
        return Optional.ofNullable(rollbacks.get(rollbackId));
    }

    @Override
    public synchronized List<RollbackRecord> findRollbacks(String deploymentId) {
        List<RollbackRecord> result = rollbacks.values().stream()
                .filter(r -> deploymentId.equals(r.getDeploymentId()))
                .collect(Collectors.toList());
        Collections.reverse(result);
        return result;
    }

    @Override
    public synchronized CanaryMetricSample saveMetricSample(CanaryMetricSample sample) {
        if (sample.getId() == null) sample.setId(UUID.randomUUID().toString());
        samples.put(sample.getId(), sample);
        return sample;
    }

    @Override
    public synchronized List<CanaryMetricSample> findMetricSamples(String deploymentId, int limit) {
        List<CanaryMetricSample> result = samples.values().stream()
                .filter(s -> deploymentId.equals(s.getDeploymentId()))
                .collect(Collectors.toList());
        Collections.reverse(result);
        return result.stream().limit(limit).collect(Collectors.toList());
    }

    @Override
    public synchronized void attachNarrative(String sampleId, String narrative) {
        CanaryMetricSample sample = samples.get(sampleId);
        if (sample != null) sample.setAdvisorNarrative(narrative);
    }

    @Override
    public synchronized <T> T inTransaction(Supplier<T> work) {
        transactions++;
        return work.get();
    }

    public synchronized int transactionCount() {
        return transactions;
    }

    public synchronized int deploymentCount() {
        return deployments.size();
    }
}
