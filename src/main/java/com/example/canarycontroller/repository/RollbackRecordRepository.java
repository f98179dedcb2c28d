package com.example.canarycontroller.repository;

import com.example.canarycontroller.domain.RollbackRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RollbackRecordRepository extends JpaRepository<RollbackRecord, String> {

    List<RollbackRecord> findByDeploymentIdOrderByCreatedAtDesc(String deploymentId);

    List<RollbackRecord> findByDeploymentIdAndStatus(String deploymentId, RollbackRecord.RollbackStatus status);

    void deleteByDeploymentId(String deploymentId);
}
