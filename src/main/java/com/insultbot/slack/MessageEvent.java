/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.slack;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The fields of a Slack {@code message} or {@code app_mention} event that the bot reads.
 *
 * @param type    "message" or "app_mention"
 * @param subtype set for edits, joins, bot posts and other non-chat messages
 * @param channel channel the message was posted in
 * @param user    sender's user id
 * @param text    message text, with mentions as {@code <@U123>}
 * @param ts      message timestamp
 * @param botId   set when a bot posted the message
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageEvent(
        String type,
        String subtype,
        String channel,
        String user,
        String text,
        String ts,
        @JsonProperty("bot_id") String botId) {

    public static final String MESSAGE = "message";
    public static final String APP_MENTION = "app_mention";

    /**
     * @param userId a Slack user id
     * @return true if the text contains a mention of that user
     */
    public boolean mentions(String userId) {
        if (text == null || userId == null || userId.isBlank()) {
            return false;
        }
        return text.contains("<@" + userId + ">") || text.contains("<@" + userId + "|");
    }

    /**
     * Only plain human messages are commands. Bot posts are skipped so the bot
     * never answers its own replies.
     *
     * @return true if the event should be handed to the dispatcher
     */
    public boolean isDispatchable() {
        return subtype == null
                && botId == null
                && hasText(user)
                && hasText(channel)
                && hasText(text);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
