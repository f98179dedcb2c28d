package com.example.canarycontroller.canary;

import com.example.canarycontroller.config.CanaryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Hands degraded or unhealthy verdicts to the {@link CanaryAdvisor} off the tick path.
 * Advice is best-effort: a failing, slow or missing advisor never affects a rollout.
 */
@Slf4j
@Component
public class AdvisoryDispatcher {

    private final ObjectProvider<CanaryAdvisor> advisorProvider;
    private final DeploymentStore store;
    private final Executor executor;
    private final CanaryProperties properties;

    public AdvisoryDispatcher(ObjectProvider<CanaryAdvisor> advisorProvider,
                              DeploymentStore store,
                              @Qualifier("advisorExecutor") Executor executor,
                              CanaryProperties properties) {
        this.advisorProvider = advisorProvider;
        this.store = store;
        this.executor = executor;
        this.properties = properties;
    }

    /**
     * @return completes with the narrative, or empty on any failure; never completes exceptionally
     */
    public CompletableFuture<Optional<String>> dispatch(AdvisoryRequest request) {
        CanaryAdvisor advisor = advisorProvider.getIfAvailable();
        if (advisor == null || !properties.getAdvisor().isEnabled()) {
            log.debug("No advisor configured, skipping advice for deployment {}", request.getDeploymentId());
            return CompletableFuture.completedFuture(Optional.empty());
        }

        CompletableFuture<Optional<String>> future;
        try {
            future = CompletableFuture.supplyAsync(() -> callAdvisor(advisor, request), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Advisor queue full, dropping advice for deployment {}", request.getDeploymentId());
            return CompletableFuture.completedFuture(Optional.empty());
        }

        return future
                .orTimeout(properties.getAdvisor().getTimeoutSeconds(), TimeUnit.SECONDS)
                .thenApply(narrative -> {
                    narrative.ifPresent(text -> attach(request, text));
                    return narrative;
                })
                .exceptionally(ex -> {
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    log.warn("Advisor failed for deployment {}: {}", request.getDeploymentId(), cause.toString());
                    return Optional.empty();
                });
    }

    private Optional<String> callAdvisor(CanaryAdvisor advisor, AdvisoryRequest request) {
        try {
            return advisor.advise(request);
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    private void attach(AdvisoryRequest request, String narrative) {
        if (request.getSampleId() == null) {
            return;
        }
        store.attachNarrative(request.getSampleId(), narrative);
        log.debug("Attached advisor narrative to sample {} of deployment {}",
                request.getSampleId(), request.getDeploymentId());
    }
}
