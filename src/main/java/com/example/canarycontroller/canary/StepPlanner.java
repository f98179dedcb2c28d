package com.example.canarycontroller.canary;

import com.example.canarycontroller.domain.DeploymentStep;
import com.example.canarycontroller.error.InvalidConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands a traffic plan (initial, target, increment) into the ordered step schedule.
 * The last step is clamped to exactly the target percent.
 */
public final class StepPlanner {

    private StepPlanner() {
    }

    /**
     * @return strictly increasing traffic percentages, ending at {@code targetPercent}
     */
    public static List<Integer> plan(int initialPercent, int targetPercent, int incrementPercent) {
        if (incrementPercent <= 0) {
            throw new InvalidConfigurationException("incrementPercent", incrementPercent, "must be positive");
        }
        if (initialPercent <= 0) {
            throw new InvalidConfigurationException("initialCanaryPercent", initialPercent, "must be positive");
        }
        if (targetPercent > 100) {
            throw new InvalidConfigurationException("targetCanaryPercent", targetPercent, "must not exceed 100");
        }
        if (initialPercent > targetPercent) {
            throw new InvalidConfigurationException("initialCanaryPercent", initialPercent,
                    "must not exceed targetCanaryPercent " + targetPercent);
        }

        List<Integer> percents = new ArrayList<>();
        int current = initialPercent;
        while (current < targetPercent) {
            percents.add(current);
            current = Math.min(current + incrementPercent, targetPercent);
        }
        percents.add(targetPercent);
        return percents;
    }

    public static List<DeploymentStep> buildSteps(String deploymentId, int initialPercent,
                                                  int targetPercent, int incrementPercent) {
        List<Integer> percents = plan(initialPercent, targetPercent, incrementPercent);
        List<DeploymentStep> steps = new ArrayList<>(percents.size());
        for (int i = 0; i < percents.size(); i++) {
            steps.add(DeploymentStep.builder()
                    .deploymentId(deploymentId)
                    .stepNumber(i + 1)
                    .targetPercent(percents.get(i))
                    .status(DeploymentStep.StepStatus.PENDING)
                    .build());
        }
        return steps;
    }
}
