package com.example.canarycontroller.service;

import com.example.canarycontroller.domain.CanaryTemplate;
import com.example.canarycontroller.error.InvalidConfigurationException;
import com.example.canarycontroller.error.ResourceNotFoundException;
import com.example.canarycontroller.repository.CanaryTemplateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * CRUD for reusable rollout templates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CanaryTemplateService {

    private final CanaryTemplateRepository templateRepository;
    private final AuditService auditService;

    public CanaryTemplate create(CanaryTemplate template, String createdBy) {
        validate(template);
        template.setId(null);
        template.setCreatedBy(createdBy);
        template.setCreatedAt(Instant.now());
        CanaryTemplate saved = templateRepository.save(template);
        log.info("Created canary template {} ({})", saved.getId(), saved.getName());
        auditService.record(createdBy, "CANARY_TEMPLATE_CREATED", saved.getId(), Map.of("name", saved.getName()), true);
        return saved;
    }

    public List<CanaryTemplate> list(String createdBy) {
        if (createdBy == null || createdBy.isBlank()) {
            return templateRepository.findAllByOrderByCreatedAtDesc();
        }
        return templateRepository.findByCreatedByOrderByCreatedAtDesc(createdBy);
    }

    public CanaryTemplate get(String id) {
        return templateRepository.findById(id).orElseThrow(() -> ResourceNotFoundException.template(id));
    }

    public void delete(String id, String actor) {
        CanaryTemplate template = get(id);
        templateRepository.delete(template);
        log.info("Deleted canary template {} ({})", id, template.getName());
        auditService.record(actor, "CANARY_TEMPLATE_DELETED", id, Map.of("name", template.getName()), true);
    }

    void validate(CanaryTemplate t) {
        if (t == null || t.getName() == null || t.getName().isBlank()) {
            throw new InvalidConfigurationException("name", t != null ? t.getName() : null, "is required");
        }
        percent("initialCanaryPercent", t.getInitialCanaryPercent());
        percent("incrementPercent", t.getIncrementPercent());
        if (t.getIncrementIntervalMinutes() != null && t.getIncrementIntervalMinutes() < 1) {
            throw new InvalidConfigurationException("incrementIntervalMinutes", t.getIncrementIntervalMinutes(),
                    "must be at least 1");
        }
        rate("errorRateThreshold", t.getErrorRateThreshold());
        rate("successRateThreshold", t.getSuccessRateThreshold());
        if (t.getLatencyThresholdMs() != null && t.getLatencyThresholdMs() < 0) {
            throw new InvalidConfigurationException("latencyThresholdMs", t.getLatencyThresholdMs(),
                    "must not be negative");
        }
    }

    private void percent(String field, Integer value) {
        if (value != null && (value < 1 || value > 100)) {
            throw new InvalidConfigurationException(field, value, "must be between 1 and 100");
        }
    }

    private void rate(String field, Double value) {
        if (value != null && (value.isNaN() || value < 0 || value > 100)) {
            throw new InvalidConfigurationException(field, value, "must be between 0 and 100");
        }
    }
}
