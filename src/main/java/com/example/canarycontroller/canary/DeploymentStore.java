package com.example.canarycontroller.canary;

import com.example.canarycontroller.domain.CanaryDeployment;
import com.example.canarycontroller.domain.CanaryMetricSample;
import com.example.canarycontroller.domain.DeploymentStep;
import com.example.canarycontroller.domain.RollbackRecord;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Persistence port for deployments and the records they own.
 * Children reference their deployment by id; deleting a deployment removes them too.
 */
public interface DeploymentStore {

    CanaryDeployment saveDeployment(CanaryDeployment deployment);

    Optional<CanaryDeployment> findDeployment(String id);

    /**
     * @param status null for every status
     */
    List<CanaryDeployment> listDeployments(CanaryDeployment.DeploymentStatus status, int limit);

    List<CanaryDeployment> findByStatusIn(List<CanaryDeployment.DeploymentStatus> statuses);

    void deleteDeployment(String id);

    DeploymentStep saveStep(DeploymentStep step);

    List<DeploymentStep> saveSteps(List<DeploymentStep> steps);

    /** Ordered by step number */
    List<DeploymentStep> findSteps(String deploymentId);

    RollbackRecord saveRollback(RollbackRecord record);

    Optional<RollbackRecord> findRollback(String rollbackId);

    /** Newest first */
    List<RollbackRecord> findRollbacks(String deploymentId);

    CanaryMetricSample saveMetricSample(CanaryMetricSample sample);

    /** Newest first */
    List<CanaryMetricSample> findMetricSamples(String deploymentId, int limit);

    void attachNarrative(String sampleId, String narrative);

    /**
     * Runs the work as one unit: either every write inside it is kept or none is.
     */
    <T> T inTransaction(Supplier<T> work);
}
