package com.example.canarycontroller.repository;

import com.example.canarycontroller.domain.CanaryDeployment;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CanaryDeploymentRepository extends JpaRepository<CanaryDeployment, String> {

    List<CanaryDeployment> findByStatusIn(List<CanaryDeployment.DeploymentStatus> statuses);

    @Query("SELECT d FROM CanaryDeployment d WHERE (:status IS NULL OR d.status = :status) ORDER BY d.createdAt DESC")
    List<CanaryDeployment> findRecent(@Param("status") CanaryDeployment.DeploymentStatus status, Pageable pageable);
}
