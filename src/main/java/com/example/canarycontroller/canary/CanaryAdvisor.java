package com.example.canarycontroller.canary;

import java.util.Optional;

/**
 * Produces a human-readable recommendation for a degraded or unhealthy canary.
 */
public interface CanaryAdvisor {

    /**
     * @return empty when the advisor has nothing to say or is not configured
     */
    Optional<String> advise(AdvisoryRequest request) throws Exception;
}
