/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.slack;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insultbot.utils.JacksonConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parses Slack Events API request bodies into {@link SlackEnvelope}s.
 *
 * <p>Only {@code message} and {@code app_mention} inner events are decoded;
 * any other event type yields an envelope without an event.
 */
public class SlackEventParser {

    private static final Set<String> MESSAGE_EVENT_TYPES = Set.of(MessageEvent.MESSAGE, MessageEvent.APP_MENTION);

    private final ObjectMapper mapper;

    public SlackEventParser() {
        this(JacksonConfig.mapper());
    }

    public SlackEventParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param body raw request body
     * @return the parsed envelope
     * @throws MalformedEnvelopeException if the body is not JSON or lacks a string {@code type}
     */
    public SlackEnvelope parse(String body) throws MalformedEnvelopeException {
        JsonNode root;
        try {
            root = mapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new MalformedEnvelopeException("request body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEnvelopeException("expected a JSON object");
        }

        String type = requireStringType(root, "slack event missing field 'type'");

        if (SlackEnvelope.URL_VERIFICATION.equals(type)) {
            JsonNode challenge = root.get("challenge");
            if (challenge == null || !challenge.isTextual()) {
                throw new MalformedEnvelopeException("url_verification missing field 'challenge'");
            }
            return new SlackEnvelope(type, challenge.asText(), null, null);
        }

        if (SlackEnvelope.EVENT_CALLBACK.equals(type)) {
            JsonNode event = root.get("event");
            if (event == null || !event.isObject()) {
                throw new MalformedEnvelopeException("event_callback missing field 'event'");
            }
            String eventType = requireStringType(event, "slack event missing field 'event.type'");
            if (!MESSAGE_EVENT_TYPES.contains(eventType)) {
                return new SlackEnvelope(type, null, null, null);
            }
            try {
                return new SlackEnvelope(type, null, mapper.treeToValue(event, MessageEvent.class), appUserIds(root));
            } catch (JsonProcessingException e) {
                throw new MalformedEnvelopeException("malformed " + eventType + " event", e);
            }
        }

        return new SlackEnvelope(type, null, null, null);
    }

    /**
     * Collects the app's own user ids from {@code authorizations[].user_id} and
     * the older {@code authed_users} list.
     */
    private static List<String> appUserIds(JsonNode root) {
        List<String> ids = new ArrayList<>();
        JsonNode authorizations = root.get("authorizations");
        if (authorizations != null && authorizations.isArray()) {
            for (JsonNode authorization : authorizations) {
                JsonNode userId = authorization.get("user_id");
                if (userId != null && userId.isTextual() && !ids.contains(userId.asText())) {
                    ids.add(userId.asText());
                }
            }
        }
        JsonNode authedUsers = root.get("authed_users");
        if (authedUsers != null && authedUsers.isArray()) {
            for (JsonNode userId : authedUsers) {
                if (userId.isTextual() && !ids.contains(userId.asText())) {
                    ids.add(userId.asText());
                }
            }
        }
        return ids;
    }

    private static String requireStringType(JsonNode node, String missingMessage) throws MalformedEnvelopeException {
        JsonNode type = node.get("type");
        if (type == null || type.isNull()) {
            throw new MalformedEnvelopeException(missingMessage);
        }
        if (!type.isTextual()) {
            throw new MalformedEnvelopeException("expected string for field 'type'");
        }
        return type.asText();
    }

    /**
     * Thrown when a request body is not a usable Slack envelope.
     */
    public static class MalformedEnvelopeException extends Exception {
        public MalformedEnvelopeException(String message) {
            super(message);
        }

        public MalformedEnvelopeException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
