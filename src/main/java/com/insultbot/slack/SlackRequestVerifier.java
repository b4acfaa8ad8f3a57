/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.slack;

import com.insultbot.utils.LoggerUtil;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.HexFormat;

/**
 * Checks Slack's request signature ({@code X-Slack-Signature}).
 *
 * <p>The expected signature is {@code v0=} followed by the hex HMAC-SHA256 of
 * {@code v0:<timestamp>:<body>} keyed with the app's signing secret.
 * Requests whose timestamp is more than five minutes away from now are refused.
 * With no signing secret configured, every request passes.
 */
public class SlackRequestVerifier {

    public static final String SIGNATURE_HEADER = "X-Slack-Signature";
    public static final String TIMESTAMP_HEADER = "X-Slack-Request-Timestamp";

    private static final String VERSION = "v0";
    private static final long MAX_SKEW_SECONDS = 5 * 60;

    private final String signingSecret;
    private final Clock clock;

    public SlackRequestVerifier(String signingSecret) {
        this(signingSecret, Clock.systemUTC());
    }

    public SlackRequestVerifier(String signingSecret, Clock clock) {
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.clock = clock;
        if (this.signingSecret.isEmpty()) {
            LoggerUtil.warn("Slack signing secret not configured, request signatures are not checked");
        }
    }

    public boolean isEnabled() {
        return !signingSecret.isEmpty();
    }

    /**
     * @param timestamp value of {@value #TIMESTAMP_HEADER}
     * @param signature value of {@value #SIGNATURE_HEADER}
     * @param body      raw request body
     * @return true if the request is authentic (or verification is disabled)
     */
    public boolean verify(String timestamp, String signature, String body) {
        if (!isEnabled()) {
            return true;
        }
        if (timestamp == null || signature == null) {
            LoggerUtil.debug("Slack request rejected: signature headers missing");
            return false;
        }

        long requestTime;
        try {
            requestTime = Long.parseLong(timestamp.trim());
        } catch (NumberFormatException e) {
            LoggerUtil.debug("Slack request rejected: bad timestamp " + timestamp);
            return false;
        }
        long now = clock.instant().getEpochSecond();
        if (Math.abs(now - requestTime) > MAX_SKEW_SECONDS) {
            LoggerUtil.warn("Slack request rejected: timestamp outside the allowed window");
            return false;
        }

        String expected = sign(timestamp.trim(), body == null ? "" : body);
        boolean valid = MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                signature.trim().getBytes(StandardCharsets.UTF_8));
        if (!valid) {
            LoggerUtil.warn("Slack request rejected: signature mismatch");
        }
        return valid;
    }

    /**
     * Computes the signature Slack would send for a request.
     */
    public String sign(String timestamp, String body) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(signingSecret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            byte[] digest = mac.doFinal((VERSION + ":" + timestamp + ":" + body).getBytes(StandardCharsets.UTF_8));
            return VERSION + "=" + HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }
}
