package com.example.canarycontroller.repository;

import com.example.canarycontroller.canary.DeploymentStore;
import com.example.canarycontroller.domain.CanaryDeployment;
import com.example.canarycontroller.domain.CanaryMetricSample;
import com.example.canarycontroller.domain.DeploymentStep;
import com.example.canarycontroller.domain.RollbackRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link DeploymentStore} backed by the Spring Data repositories.
 */
@Slf4j
@Component
public class JpaDeploymentStore implements DeploymentStore {

    private final CanaryDeploymentRepository deploymentRepository;
    private final DeploymentStepRepository stepRepository;
    private final RollbackRecordRepository rollbackRepository;
    private final CanaryMetricSampleRepository sampleRepository;
    private final TransactionTemplate transactionTemplate;

    public JpaDeploymentStore(CanaryDeploymentRepository deploymentRepository,
                              DeploymentStepRepository stepRepository,
                              RollbackRecordRepository rollbackRepository,
                              CanaryMetricSampleRepository sampleRepository,
                              PlatformTransactionManager transactionManager) {
        this.deploymentRepository = deploymentRepository;
        this.stepRepository = stepRepository;
        this.rollbackRepository = rollbackRepository;
        this.sampleRepository = sampleRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public CanaryDeployment saveDeployment(CanaryDeployment deployment) {
        return deploymentRepository.save(deployment);
    }

    @Override
    public Optional<CanaryDeployment> findDeployment(String id) {
        return deploymentRepository.findById(id);
    }

    @Override
    public List<CanaryDeployment> listDeployments(CanaryDeployment.DeploymentStatus status, int limit) {
        return deploymentRepository.findRecent(status, PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    public List<CanaryDeployment> findByStatusIn(List<CanaryDeployment.DeploymentStatus> statuses) {
        return deploymentRepository.findByStatusIn(statuses);
    }

    @Override
    @Transactional
    public void deleteDeployment(String id) {
        sampleRepository.deleteByDeploymentId(id);
        rollbackRepository.deleteByDeploymentId(id);
        stepRepository.deleteByDeploymentId(id);
        deploymentRepository.deleteById(id);
    }

    @Override
    public DeploymentStep saveStep(DeploymentStep step) {
        return stepRepository.save(step);
    }

    @Override
    public List<DeploymentStep> saveSteps(List<DeploymentStep> steps) {
        return stepRepository.saveAll(steps);
    }

    @Override
    public List<DeploymentStep> findSteps(String deploymentId) {
        return stepRepository.findByDeploymentIdOrderByStepNumber(deploymentId);
    }

    @Override
    public RollbackRecord saveRollback(RollbackRecord record) {
        return rollbackRepository.save(record);
    }

    @Override
    public Optional<RollbackRecord> findRollback(String rollbackId) {
        return rollbackRepository.findById(rollbackId);
    }

    @Override
    public List<RollbackRecord> findRollbacks(String deploymentId) {
        return rollbackRepository.findByDeploymentIdOrderByCreatedAtDesc(deploymentId);
    }

    @Override
    public CanaryMetricSample saveMetricSample(CanaryMetricSample sample) {
        return sampleRepository.save(sample);
    }

    @Override
    public List<CanaryMetricSample> findMetricSamples(String deploymentId, int limit) {
        return sampleRepository.findRecent(deploymentId, PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    @Transactional
    public void attachNarrative(String sampleId, String narrative) {
        sampleRepository.findById(sampleId).ifPresentOrElse(sample -> {
            sample.setAdvisorNarrative(narrative);
            sampleRepository.save(sample);
        }, () -> log.debug("Sample {} no longer exists, narrative dropped", sampleId));
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }
}
