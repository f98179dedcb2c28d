package com.example.canarycontroller;

import com.example.canarycontroller.canary.CanaryOrchestrator;
import com.example.canarycontroller.config.CanaryProperties;
import com.example.canarycontroller.service.RolloutDriver;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class CanaryControllerApplicationTests {

    private static final String CREATE_BODY = """
            {
              "name": "checkout-canary",
              "namespace": "shop",
              "targetDeployment": "checkout",
              "canaryImage": "registry.local/checkout:2.0.0",
              "canaryVersion": "2.0.0",
              "stableImage": "registry.local/checkout:1.9.3",
              "stableVersion": "1.9.3",
              "incrementPercent": 30
            }
            """;

    private static final String HEALTHY_METRICS = """
            {"canaryErrorRate": 1.0, "stableErrorRate": 0.8, "canaryAvgLatencyMs": 200,
             "stableAvgLatencyMs": 180, "canaryHealthyPods": 3, "canaryTotalPods": 3}
            """;

    private static final String ERRORING_METRICS = """
            {"canaryErrorRate": 12.5, "stableErrorRate": 0.8, "canaryAvgLatencyMs": 200,
             "stableAvgLatencyMs": 180, "canaryHealthyPods": 3, "canaryTotalPods": 3}
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private CanaryProperties properties;

    @Autowired
    private CanaryOrchestrator orchestrator;

    @Autowired
    private RolloutDriver driver;

    @Test
    void contextLoads() {
        assertNotNull(orchestrator);
        assertNotNull(driver);
    }

    @Test
    void configurationIsLoaded() {
        assertEquals(10, properties.getDefaults().getInitialCanaryPercent());
        assertFalse(properties.getAdvisor().isEnabled());
        assertFalse(properties.getDriver().isEnabled());
    }

    @Test
    void healthyRolloutIsPromotedOverApi() throws Exception {
        String id = createDeployment();

        mockMvc.perform(post("/api/canary/{id}/start", id).header("X-Actor", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("APPLY_SPLIT"))
                .andExpect(jsonPath("$.canaryPercent").value(10))
                .andExpect(jsonPath("$.deployment.status").value("INITIALIZING"));

        tick(id, HEALTHY_METRICS)
                .andExpect(jsonPath("$.canaryPercent").value(40))
                .andExpect(jsonPath("$.deployment.status").value("PROGRESSING"))
                .andExpect(jsonPath("$.analysis.analysisResult").value("HEALTHY"));
        tick(id, HEALTHY_METRICS).andExpect(jsonPath("$.canaryPercent").value(70));
        tick(id, HEALTHY_METRICS)
                .andExpect(jsonPath("$.action").value("PROMOTE"))
                .andExpect(jsonPath("$.canaryPercent").value(100))
                .andExpect(jsonPath("$.deployment.status").value("PROMOTED"));

        mockMvc.perform(get("/api/canary/{id}/steps", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(4))
                .andExpect(jsonPath("$[3].status").value("COMPLETED"));
        mockMvc.perform(get("/api/canary/{id}/metrics", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3));
    }

    @Test
    void unhealthyRolloutIsRolledBackOverApi() throws Exception {
        String id = createDeployment();
        mockMvc.perform(post("/api/canary/{id}/start", id)).andExpect(status().isOk());

        tick(id, ERRORING_METRICS)
                .andExpect(jsonPath("$.action").value("REVERT_TO_STABLE"))
                .andExpect(jsonPath("$.deployment.status").value("ROLLED_BACK"))
                .andExpect(jsonPath("$.canaryPercent").value(0))
                .andExpect(jsonPath("$.rollbackId").exists());

        mockMvc.perform(get("/api/canary/{id}/rollbacks", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].trigger").value("AUTO_ERROR_RATE"))
                .andExpect(jsonPath("$[0].status").value("COMPLETED"))
                .andExpect(jsonPath("$[0].canaryPercentAtRollback").value(10))
                .andExpect(jsonPath("$[0].reason", startsWith("Error rate 12.50% exceeds threshold 5%")));
    }

    @Test
    void partialMetricsHoldInsteadOfRollingBack() throws Exception {
        String id = createDeployment();
        mockMvc.perform(post("/api/canary/{id}/start", id)).andExpect(status().isOk());

        tick(id, "{\"canaryErrorRate\": 1, \"canaryAvgLatencyMs\": 200}")
                .andExpect(jsonPath("$.action").value("NONE"))
                .andExpect(jsonPath("$.deployment.status").value("INITIALIZING"))
                .andExpect(jsonPath("$.canaryPercent").value(10))
                .andExpect(jsonPath("$.analysis.analysisResult").value("INCONCLUSIVE"))
                .andExpect(jsonPath("$.analysis.reasons[0]").value("Incomplete metrics, missing canaryHealthyPods"));

        mockMvc.perform(get("/api/canary/{id}/rollbacks", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void illegalTransitionIsConflict() throws Exception {
        String id = createDeployment();
        mockMvc.perform(post("/api/canary/{id}/cancel", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));

        mockMvc.perform(post("/api/canary/{id}/pause", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CC-520"))
                .andExpect(jsonPath("$.metadata.currentState").value("CANCELLED"));
    }

    @Test
    void metricsForFinishedDeploymentAreRejected() throws Exception {
        String id = createDeployment();
        mockMvc.perform(post("/api/canary/{id}/start", id)).andExpect(status().isOk());
        tick(id, ERRORING_METRICS).andExpect(jsonPath("$.deployment.status").value("ROLLED_BACK"));

        mockMvc.perform(post("/api/canary/{id}/metrics", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(HEALTHY_METRICS))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.metadata.currentState").value("ROLLED_BACK"));
    }

    @Test
    void unknownDeploymentIsNotFound() throws Exception {
        mockMvc.perform(get("/api/canary/{id}", "does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("CC-301"))
                .andExpect(jsonPath("$.metadata.resourceId").value("does-not-exist"));
    }

    @Test
    void invalidConfigurationIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/canary")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetDeployment\": \"checkout\", \"canaryImage\": \"img:2\", \"initialCanaryPercent\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("CC-100"))
                .andExpect(jsonPath("$.fieldErrors[0].field").value("initialCanaryPercent"));
    }

    @Test
    void templatesSupplyRolloutSettings() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/canary/templates")
                        .header("X-Actor", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"cautious\", \"initialCanaryPercent\": 5, \"incrementPercent\": 5}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.createdBy").value("alice"))
                .andReturn();
        String templateId = readId(created);

        mockMvc.perform(post("/api/canary")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetDeployment\": \"search\", \"canaryImage\": \"search:3\", \"templateId\": \""
                                + templateId + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("search-canary"))
                .andExpect(jsonPath("$.initialCanaryPercent").value(5))
                .andExpect(jsonPath("$.incrementPercent").value(5));
    }

    private String createDeployment() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/canary")
                        .header("X-Actor", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.createdBy").value("alice"))
                .andReturn();
        return readId(result);
    }

    private ResultActions tick(String id, String metrics) throws Exception {
        return mockMvc.perform(post("/api/canary/{id}/tick", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(metrics))
                .andExpect(status().isOk());
    }

    private String readId(MvcResult result) throws Exception {
        JsonNode node = objectMapper.readTree(result.getResponse().getContentAsString());
        return node.get("id").asText();
    }
}
