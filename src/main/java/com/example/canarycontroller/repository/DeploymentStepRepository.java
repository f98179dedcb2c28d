package com.example.canarycontroller.repository;

import com.example.canarycontroller.domain.DeploymentStep;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DeploymentStepRepository extends JpaRepository<DeploymentStep, String> {

    List<DeploymentStep> findByDeploymentIdOrderByStepNumber(String deploymentId);

    void deleteByDeploymentId(String deploymentId);
}
