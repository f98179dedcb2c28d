package com.example.canarycontroller;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Canary Controller - progressive delivery engine for Kubernetes workloads.
 *
 * A poll-driven control plane that shifts traffic to a new version in
 * health-gated increments and promotes or rolls back automatically.
 *
 * Architecture:
 * - Progression Engine → per-deployment state machine, advanced by external ticks
 * - Health Analyzer → threshold verdicts over canary vs stable metrics
 * - Rollback Manager → rollback records and terminal state
 * - Rollout Driver → applies traffic actions through the workload controller
 * - Advisor → optional LLM narrative for degraded rollouts
 */
@SpringBootApplication
@EnableScheduling
@EnableAsync
public class CanaryControllerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CanaryControllerApplication.class, args);
    }
}
