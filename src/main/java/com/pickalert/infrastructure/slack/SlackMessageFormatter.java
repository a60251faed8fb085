package com.pickalert.infrastructure.slack;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pickalert.domain.model.PickNotification;

/**
 * Renders pick alerts as Slack Block Kit messages.
 */
public class SlackMessageFormatter {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    static final String HEADER_TEXT = "*PICK ALERT!* :mega:";

    private SlackMessageFormatter() {
    }

    /**
     * Builds a {@code chat.postMessage} body: header, pick fields, and the on-the-clock line when present.
     */
    public static ObjectNode toMessage(String channelId, PickNotification notification) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("channel", channelId);
        message.put("text", notification.summary());

        ArrayNode blocks = message.putArray("blocks");
        blocks.add(section(HEADER_TEXT));

        ObjectNode fieldsSection = blocks.addObject();
        fieldsSection.put("type", "section");
        ArrayNode fields = fieldsSection.putArray("fields");
        fields.add(markdown("*Round:*\n" + notification.round()));
        fields.add(markdown("*Pick:*\n" + notification.pickNumber()));
        fields.add(markdown("*Player Drafted:*\n`" + notification.playerName() + "`"));
        fields.add(markdown("*Position:*\n" + notification.position()));
        fields.add(markdown("*Picked By:*\n" + notification.pickedByLabel()));

        if (notification.onTheClock().isPresent()) {
            blocks.addObject().put("type", "divider");
            blocks.add(section("*On The Clock:*\n" + notification.onTheClock().label()));
        }
        return message;
    }

    /**
     * Builds a plain text {@code chat.postMessage} body.
     */
    public static ObjectNode toTextMessage(String channelId, String text) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("channel", channelId);
        message.put("text", text);
        return message;
    }

    private static JsonNode section(String text) {
        ObjectNode section = objectMapper.createObjectNode();
        section.put("type", "section");
        section.set("text", markdown(text));
        return section;
    }

    private static ObjectNode markdown(String text) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", "mrkdwn");
        node.put("text", text);
        return node;
    }
}
