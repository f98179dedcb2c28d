package com.example.canarycontroller.repository;

import com.example.canarycontroller.domain.CanaryTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CanaryTemplateRepository extends JpaRepository<CanaryTemplate, String> {

    List<CanaryTemplate> findAllByOrderByCreatedAtDesc();

    List<CanaryTemplate> findByCreatedByOrderByCreatedAtDesc(String createdBy);
}
