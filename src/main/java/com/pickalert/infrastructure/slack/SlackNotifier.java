package com.pickalert.infrastructure.slack;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pickalert.domain.model.PickNotification;
import com.pickalert.domain.ports.NotificationDeliveryException;
import com.pickalert.domain.ports.Notifier;
import com.pickalert.infrastructure.http.HttpClientUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * Delivers alerts through Slack's {@code chat.postMessage}.
 * Slack reports most failures as HTTP 200 with {@code "ok": false}; those are treated as failed deliveries.
 */
@Component
public class SlackNotifier implements Notifier {

    private static final Logger logger = LoggerFactory.getLogger(SlackNotifier.class);

    private final String baseUrl;
    private final String botToken;

    public SlackNotifier(
            @Value("${slack.api.base-url:https://slack.com/api}") String baseUrl,
            @Value("${slack.bot-token:}") String botToken) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.botToken = botToken;
    }

    @Override
    public void send(String channelId, PickNotification notification) throws NotificationDeliveryException {
        post(SlackMessageFormatter.toMessage(channelId, notification));
        logger.debug("Posted pick {} to channel {}", notification.pickNumber(), channelId);
    }

    /**
     * Posts a plain text message.
     */
    public void sendText(String channelId, String text) throws NotificationDeliveryException {
        post(SlackMessageFormatter.toTextMessage(channelId, text));
    }

    private void post(ObjectNode message) throws NotificationDeliveryException {
        if (botToken == null || botToken.isBlank()) {
            throw new NotificationDeliveryException("Slack bot token is not configured");
        }

        String channelId = message.path("channel").asText();
        JsonNode response;
        try {
            response = HttpClientUtil.postJson(
                baseUrl + "/chat.postMessage",
                message,
                Map.of("Authorization", "Bearer " + botToken)
            );
        } catch (IOException e) {
            throw new NotificationDeliveryException("Slack request to channel " + channelId + " failed", e);
        }

        if (response == null || !response.path("ok").asBoolean(false)) {
            String error = response != null ? response.path("error").asText("unknown_error") : "empty_response";
            throw new NotificationDeliveryException("Slack rejected message to channel " + channelId + ": " + error);
        }
    }
}
