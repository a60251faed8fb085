package com.pickalert.infrastructure.slack;

import com.pickalert.domain.ports.NotificationDeliveryException;
import com.pickalert.domain.ports.OperatorAlerter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Logs operator alerts and, when an operator channel is configured, posts them to Slack as well.
 */
@Component
public class SlackOperatorAlerter implements OperatorAlerter {

    private static final Logger logger = LoggerFactory.getLogger(SlackOperatorAlerter.class);

    private final SlackNotifier slackNotifier;
    private final String operatorChannel;

    public SlackOperatorAlerter(
            SlackNotifier slackNotifier,
            @Value("${alerts.operator-channel:}") String operatorChannel) {
        this.slackNotifier = slackNotifier;
        this.operatorChannel = operatorChannel;
    }

    @Override
    public void alert(String draftId, String message) {
        logger.error("OPERATOR ALERT for draft {}: {}", draftId, message);
        if (operatorChannel == null || operatorChannel.isBlank()) {
            return;
        }
        try {
            slackNotifier.sendText(operatorChannel,
                ":rotating_light: Draft `" + draftId + "` monitoring is halted: " + message);
        } catch (NotificationDeliveryException e) {
            logger.error("Could not post operator alert for draft {} to channel {}", draftId, operatorChannel, e);
        }
    }
}
