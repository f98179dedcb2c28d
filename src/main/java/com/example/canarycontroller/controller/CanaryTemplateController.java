package com.example.canarycontroller.controller;

import com.example.canarycontroller.domain.CanaryTemplate;
import com.example.canarycontroller.service.CanaryTemplateService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/canary/templates")
@RequiredArgsConstructor
public class CanaryTemplateController {

    private final CanaryTemplateService templateService;

    @PostMapping
    public ResponseEntity<CanaryTemplate> create(@RequestBody CanaryTemplate template,
                                                 @RequestHeader(value = CanaryController.ACTOR_HEADER, defaultValue = "api") String actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(templateService.create(template, actor));
    }

    @GetMapping
    public ResponseEntity<List<CanaryTemplate>> list(@RequestParam(required = false) String createdBy) {
        return ResponseEntity.ok(templateService.list(createdBy));
    }

    @GetMapping("/{id}")
    public ResponseEntity<CanaryTemplate> get(@PathVariable String id) {
        return ResponseEntity.ok(templateService.get(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String id,
                                                      @RequestHeader(value = CanaryController.ACTOR_HEADER, defaultValue = "api") String actor) {
        templateService.delete(id, actor);
        return ResponseEntity.ok(Map.of("deleted", true, "id", id));
    }
}
