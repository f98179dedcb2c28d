package com.example.canarycontroller.repository;

import com.example.canarycontroller.domain.CanaryMetricSample;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CanaryMetricSampleRepository extends JpaRepository<CanaryMetricSample, String> {

    @Query("SELECT s FROM CanaryMetricSample s WHERE s.deploymentId = :deploymentId ORDER BY s.sampledAt DESC")
    List<CanaryMetricSample> findRecent(@Param("deploymentId") String deploymentId, Pageable pageable);

    void deleteByDeploymentId(String deploymentId);
}
