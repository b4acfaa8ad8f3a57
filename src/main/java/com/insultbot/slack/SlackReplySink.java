/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.slack;

import com.google.gson.Gson;
import com.google.gson.JsonSyntaxException;
import com.google.gson.annotations.SerializedName;
import com.insultbot.command.ReplySink;
import com.insultbot.utils.LoggerUtil;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Properties;

/**
 * Posts replies through Slack's {@code chat.postMessage} Web API.
 *
 * Slack API docs: https://api.slack.com/methods/chat.postMessage
 *
 * <p>Failures (missing token, network errors, HTTP errors, {@code "ok": false})
 * are logged and dropped; replies are never retried.
 */
public class SlackReplySink implements ReplySink {

    private static final String DEFAULT_API_URL = "https://slack.com/api";
    private static final long DEFAULT_TIMEOUT_MS = 10000;

    private final String apiUrl;
    private final String botToken;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final Gson gson;

    public SlackReplySink(Properties config) {
        String url = config.getProperty("slack.api.url", DEFAULT_API_URL).trim();
        this.apiUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.botToken = config.getProperty("slack.bot.token", "").trim();
        this.requestTimeout = Duration.ofMillis(parseTimeout(config.getProperty("slack.request.timeout.ms")));
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .build();
        this.gson = new Gson();

        if (botToken.isEmpty()) {
            LoggerUtil.warn("Slack bot token is not configured, replies will not be delivered");
        } else {
            LoggerUtil.info("SlackReplySink initialized (api: " + apiUrl + ")");
        }
    }

    public boolean isEnabled() {
        return !botToken.isEmpty();
    }

    @Override
    public void send(String channel, String text) {
        if (!isEnabled()) {
            LoggerUtil.error("Error sending message to " + channel + ": Slack bot token is not configured");
            return;
        }
        try {
            postMessage(channel, text);
        } catch (SlackApiException e) {
            LoggerUtil.error("Error sending message to " + channel + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LoggerUtil.error("Interrupted while sending message to " + channel);
        }
    }

    private void postMessage(String channel, String text) throws SlackApiException, InterruptedException {
        String jsonBody = gson.toJson(new PostMessageRequest(channel, text));

        HttpRequest httpRequest = HttpRequest.newBuilder()
            .uri(URI.create(apiUrl + "/chat.postMessage"))
            .header("Authorization", "Bearer " + botToken)
            .header("Content-Type", "application/json; charset=utf-8")
            .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
            .timeout(requestTimeout)
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SlackApiException("request failed: " + e.getMessage(), e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new SlackApiException("HTTP " + response.statusCode() + " - " + response.body());
        }

        PostMessageResponse result;
        try {
            result = gson.fromJson(response.body(), PostMessageResponse.class);
        } catch (JsonSyntaxException e) {
            throw new SlackApiException("unreadable response: " + e.getMessage(), e);
        }
        if (result == null || !result.ok) {
            throw new SlackApiException("Slack API error: " + (result == null ? "empty response" : result.error));
        }
        LoggerUtil.debug(() -> "Reply posted to " + channel + " (ts " + result.ts + ")");
    }

    private static long parseTimeout(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_TIMEOUT_MS;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            LoggerUtil.warn("Invalid slack.request.timeout.ms value: " + value + ", using default: " + DEFAULT_TIMEOUT_MS + "ms");
            return DEFAULT_TIMEOUT_MS;
        }
    }

    // Request/Response DTOs for chat.postMessage

    private record PostMessageRequest(String channel, String text) {}

    private static class PostMessageResponse {
        @SerializedName("ok")
        boolean ok;

        @SerializedName("error")
        String error;

        @SerializedName("ts")
        String ts;
    }

    /**
     * Raised inside the sink when Slack rejects or cannot receive a message.
     */
    static class SlackApiException extends Exception {
        SlackApiException(String message) {
            super(message);
        }

        SlackApiException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
