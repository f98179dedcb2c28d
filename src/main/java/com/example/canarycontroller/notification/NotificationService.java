package com.example.canarycontroller.notification;

import com.example.canarycontroller.canary.CanaryDeploymentEvent;
import com.example.canarycontroller.config.CanaryProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Posts rollout outcomes (promotion, rollback, failure) to Slack.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private static final MediaType JSON = MediaType.get("application/json");

    static final Set<CanaryDeploymentEvent.Type> NOTIFIED = EnumSet.of(
            CanaryDeploymentEvent.Type.PROMOTED,
            CanaryDeploymentEvent.Type.ROLLBACK_INITIATED,
            CanaryDeploymentEvent.Type.ROLLED_BACK,
            CanaryDeploymentEvent.Type.ROLLBACK_FAILED,
            CanaryDeploymentEvent.Type.FAILED);

    private final CanaryProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Async("eventExecutor")
    @EventListener
    public void onDeploymentEvent(CanaryDeploymentEvent event) {
        if (!NOTIFIED.contains(event.type())) return;
        if (!properties.getNotifications().getSlack().isEnabled()) return;
        sendSlackNotification(event);
    }

    public void sendSlackNotification(CanaryDeploymentEvent event) {
        String webhookUrl = properties.getNotifications().getSlack().getWebhookUrl();
        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.warn("Slack webhook URL not configured");
            return;
        }

        try {
            String json = objectMapper.writeValueAsString(Map.of(
                    "text", formatMessage(event),
                    "username", "Canary Controller",
                    "icon_emoji", ":hatching_chick:"));
            Request request = new Request.Builder()
                    .url(webhookUrl)
                    .post(RequestBody.create(json, JSON))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                if (response.isSuccessful()) {
                    log.info("Slack notification sent for deployment {} ({})", event.deploymentId(), event.type());
                } else {
                    log.error("Slack notification failed: {}", response.code());
                }
            }
        } catch (IOException e) {
            log.error("Failed to send Slack notification: {}", e.getMessage());
        }
    }

    String formatMessage(CanaryDeploymentEvent event) {
        String emoji = switch (event.type()) {
            case PROMOTED -> ":white_check_mark:";
            case ROLLBACK_INITIATED -> ":rewind:";
            case ROLLED_BACK -> ":leftwards_arrow_with_hook:";
            case ROLLBACK_FAILED, FAILED -> ":rotating_light:";
            default -> ":information_source:";
        };
        return String.format("%s *Canary %s: %s*\nStatus: %s at %d%%\n%s\nID: %s",
                emoji, event.type(), event.deploymentName(), event.status(), event.canaryPercent(),
                event.message() != null ? event.message() : "", event.deploymentId());
    }
}
