/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.slack;

import java.util.List;

/**
 * Outer Slack Events API payload.
 *
 * @param type      "url_verification", "event_callback", or another envelope type
 * @param challenge handshake value, only for url_verification
 * @param event     the inner message event, only for event_callback carrying a
 *                  message or app_mention; null otherwise
 * @param appUserIds user ids the app is installed as (from {@code authorizations}
 *                   and {@code authed_users}); never null
 */
public record SlackEnvelope(String type, String challenge, MessageEvent event, List<String> appUserIds) {

    public static final String URL_VERIFICATION = "url_verification";
    public static final String EVENT_CALLBACK = "event_callback";

    public boolean isUrlVerification() {
        return URL_VERIFICATION.equals(type);
    }

    public boolean isEventCallback() {
        return EVENT_CALLBACK.equals(type);
    }

    public SlackEnvelope {
        appUserIds = appUserIds == null ? List.of() : List.copyOf(appUserIds);
    }

    public boolean hasMessageEvent() {
        return event != null;
    }

    /**
     * A plain {@code message} that mentions the app is also delivered as an
     * {@code app_mention}; only the mention copy is handled.
     *
     * @return true if this event duplicates an app_mention delivery
     */
    public boolean isShadowedByAppMention() {
        return event != null
                && MessageEvent.MESSAGE.equals(event.type())
                && appUserIds.stream().anyMatch(event::mentions);
    }
}
