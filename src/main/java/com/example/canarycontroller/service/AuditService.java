package com.example.canarycontroller.service;

import com.example.canarycontroller.canary.CanaryDeploymentEvent;
import com.example.canarycontroller.config.CanaryProperties;
import com.example.canarycontroller.domain.AuditLog;
import com.example.canarycontroller.repository.AuditLogRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Audit trail of deployment lifecycle events and template changes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final CanaryProperties properties;

    @Async("eventExecutor")
    @EventListener
    public void onDeploymentEvent(CanaryDeploymentEvent event) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("name", event.deploymentName());
        if (event.message() != null) {
            details.put("message", event.message());
        }
        boolean success = event.type() != CanaryDeploymentEvent.Type.FAILED
                && event.type() != CanaryDeploymentEvent.Type.ROLLBACK_FAILED;
        write(AuditLog.builder()
                .actor(event.actor())
                .action(event.type().auditAction())
                .target(event.deploymentId())
                .deploymentStatus(event.status() != null ? event.status().name() : null)
                .canaryPercent(event.canaryPercent())
                .success(success)
                .timestamp(event.timestamp()), details);
    }

    public void record(String actor, String action, String target, Map<String, Object> details, boolean success) {
        write(AuditLog.builder()
                .actor(actor)
                .action(action)
                .target(target)
                .success(success)
                .timestamp(Instant.now()), details);
    }

    private void write(AuditLog.AuditLogBuilder builder, Map<String, Object> details) {
        if (!properties.getAudit().isEnabled()) return;
        try {
            AuditLog entry = builder
                    .details(details != null ? objectMapper.writeValueAsString(details) : null)
                    .build();
            if (entry.getActor() == null) {
                entry.setActor("system");
            }
            auditLogRepository.save(entry);
            log.debug("Audit: [{}] {} -> {} ({})", entry.getActor(), entry.getAction(), entry.getTarget(),
                    entry.isSuccess() ? "OK" : "FAIL");
        } catch (Exception e) {
            log.error("Failed to write audit log: {}", e.getMessage());
        }
    }

    public List<AuditLog> getRecent(int limit) {
        return auditLogRepository.findAllPaged(PageRequest.of(0, Math.max(1, limit))).getContent();
    }

    public List<AuditLog> getByTarget(String target) {
        return auditLogRepository.findByTargetOrderByTimestampDesc(target);
    }
}
