package com.example.canarycontroller.controller;

import com.example.canarycontroller.domain.AuditLog;
import com.example.canarycontroller.service.AuditService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditService auditService;

    @GetMapping
    public ResponseEntity<List<AuditLog>> recent(@RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(auditService.getRecent(limit));
    }

    @GetMapping("/target/{target}")
    public ResponseEntity<List<AuditLog>> byTarget(@PathVariable String target) {
        return ResponseEntity.ok(auditService.getByTarget(target));
    }
}
