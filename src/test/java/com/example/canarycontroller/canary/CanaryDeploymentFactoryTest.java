package com.example.canarycontroller.canary;

import com.example.canarycontroller.config.CanaryProperties;
import com.example.canarycontroller.domain.CanaryDeployment;
import com.example.canarycontroller.domain.CanaryTemplate;
import com.example.canarycontroller.error.InvalidConfigurationException;
import com.example.canarycontroller.error.ResourceNotFoundException;
import com.example.canarycontroller.repository.CanaryTemplateRepository;
import com.example.canarycontroller.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CanaryDeploymentFactoryTest {

    private CanaryProperties properties;
    private CanaryTemplateRepository templateRepository;
    private CanaryDeploymentFactory factory;

    @BeforeEach
    void setUp() {
        properties = new CanaryProperties();
        templateRepository = mock(CanaryTemplateRepository.class);
        factory = new CanaryDeploymentFactory(properties, templateRepository);
    }

    @Test
    void defaultsFillUnsetFields() {
        CanaryDeployment deployment = factory.build(EngineFixture.request(), "alice");

        assertEquals(CanaryDeployment.DeploymentStatus.PENDING, deployment.getStatus());
        assertEquals(0, deployment.getCurrentCanaryPercent());
        assertEquals("default", deployment.getNamespace());
        assertEquals(10, deployment.getInitialCanaryPercent());
        assertEquals(100, deployment.getTargetCanaryPercent());
        assertEquals(5.0, deployment.getErrorRateThreshold());
        assertEquals(1000L, deployment.getLatencyThresholdMs());
        assertEquals(95.0, deployment.getSuccessRateThreshold());
        assertTrue(deployment.isAutoRollbackEnabled());
        assertFalse(deployment.isRequireManualApproval());
        assertEquals("alice", deployment.getCreatedBy());
        assertNotNull(deployment.getCreatedAt());
    }

    @Test
    void requestOverridesTemplateWhichOverridesDefaults() {
        CanaryTemplate template = CanaryTemplate.builder()
                .id("tpl-1")
                .name("cautious")
                .initialCanaryPercent(5)
                .incrementPercent(5)
                .errorRateThreshold(1.0)
                .requireManualApproval(true)
                .build();
        when(templateRepository.findById("tpl-1")).thenReturn(Optional.of(template));

        CanaryDeploymentRequest request = EngineFixture.request();
        request.setTemplateId("tpl-1");
        request.setIncrementPercent(25);

        CanaryDeployment deployment = factory.build(request, "alice");

        assertEquals(5, deployment.getInitialCanaryPercent());
        assertEquals(25, deployment.getIncrementPercent());
        assertEquals(1.0, deployment.getErrorRateThreshold());
        assertTrue(deployment.isRequireManualApproval());
        assertEquals(1000L, deployment.getLatencyThresholdMs());
    }

    @Test
    void missingTemplateIsNotFound() {
        when(templateRepository.findById("missing")).thenReturn(Optional.empty());
        CanaryDeploymentRequest request = EngineFixture.request();
        request.setTemplateId("missing");

        assertThrows(ResourceNotFoundException.class, () -> factory.build(request, "alice"));
    }

    @Test
    void nameDefaultsFromTarget() {
        CanaryDeploymentRequest request = EngineFixture.request();
        request.setName(null);

        assertEquals("checkout-canary", factory.build(request, "alice").getName());
    }

    @Test
    void requiredFieldsAreEnforced() {
        CanaryDeploymentRequest noTarget = EngineFixture.request();
        noTarget.setTargetDeployment(" ");
        CanaryDeploymentRequest noImage = EngineFixture.request();
        noImage.setCanaryImage(null);

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
                () -> factory.build(noTarget, "alice"));
        assertEquals("targetDeployment", e.getField());
        assertThrows(InvalidConfigurationException.class, () -> factory.build(noImage, "alice"));
        assertThrows(InvalidConfigurationException.class, () -> factory.build(null, "alice"));
    }

    @Test
    void outOfRangeValuesAreRejected() {
        CanaryDeploymentRequest percent = EngineFixture.request();
        percent.setInitialCanaryPercent(0);
        CanaryDeploymentRequest interval = EngineFixture.request();
        interval.setIncrementIntervalMinutes(0);
        CanaryDeploymentRequest errorRate = EngineFixture.request();
        errorRate.setErrorRateThreshold(150.0);
        CanaryDeploymentRequest latency = EngineFixture.request();
        latency.setLatencyThresholdMs(-1L);
        CanaryDeploymentRequest pods = EngineFixture.request();
        pods.setMinHealthyPods(0);
        CanaryDeploymentRequest inverted = EngineFixture.request();
        inverted.setInitialCanaryPercent(60);
        inverted.setTargetCanaryPercent(50);

        assertEquals("initialCanaryPercent",
                assertThrows(InvalidConfigurationException.class, () -> factory.build(percent, "a")).getField());
        assertEquals("incrementIntervalMinutes",
                assertThrows(InvalidConfigurationException.class, () -> factory.build(interval, "a")).getField());
        assertEquals("errorRateThreshold",
                assertThrows(InvalidConfigurationException.class, () -> factory.build(errorRate, "a")).getField());
        assertEquals("latencyThresholdMs",
                assertThrows(InvalidConfigurationException.class, () -> factory.build(latency, "a")).getField());
        assertEquals("minHealthyPods",
                assertThrows(InvalidConfigurationException.class, () -> factory.build(pods, "a")).getField());
        assertThrows(InvalidConfigurationException.class, () -> factory.build(inverted, "a"));
    }
}
