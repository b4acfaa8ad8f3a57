/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.unit.slack;

import com.insultbot.slack.SlackRequestVerifier;
import com.insultbot.utils.LoggerUtil;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class SlackRequestVerifierTest {

    private static final String SECRET = "8f742231b10e8888abcd99yyyzzz85a5";
    private static final String TIMESTAMP = "1531420618";
    private static final String BODY = "{\"type\":\"url_verification\",\"challenge\":\"abc\"}";
    private static final String SIGNATURE = "v0=ae6e383ee58dd0c92dd248df269b7153bdd89895087b58885a6703496ce22369";

    @BeforeAll
    static void silenceLogs() {
        LoggerUtil.setSilent(true);
    }

    @AfterAll
    static void restoreLogs() {
        LoggerUtil.setSilent(false);
    }

    private static SlackRequestVerifier verifierAt(long epochSecond) {
        return new SlackRequestVerifier(SECRET, Clock.fixed(Instant.ofEpochSecond(epochSecond), ZoneOffset.UTC));
    }

    @Test
    void shouldComputeSlackSignature() {
        assertEquals(SIGNATURE, verifierAt(1531420618L).sign(TIMESTAMP, BODY));
    }

    @Test
    void shouldAcceptValidSignature() {
        assertTrue(verifierAt(1531420618L + 60).verify(TIMESTAMP, SIGNATURE, BODY));
    }

    @Test
    void shouldRejectTamperedBody() {
        assertFalse(verifierAt(1531420618L).verify(TIMESTAMP, SIGNATURE, BODY.replace("abc", "abd")));
    }

    @Test
    void shouldRejectWrongSecret() {
        SlackRequestVerifier other = new SlackRequestVerifier("another-secret",
                Clock.fixed(Instant.ofEpochSecond(1531420618L), ZoneOffset.UTC));

        assertFalse(other.verify(TIMESTAMP, SIGNATURE, BODY));
    }

    @Test
    void shouldRejectStaleTimestamp() {
        assertFalse(verifierAt(1531420618L + 301).verify(TIMESTAMP, SIGNATURE, BODY));
        assertFalse(verifierAt(1531420618L - 301).verify(TIMESTAMP, SIGNATURE, BODY));
    }

    @Test
    void shouldRejectMissingOrBadHeaders() {
        SlackRequestVerifier verifier = verifierAt(1531420618L);

        assertFalse(verifier.verify(null, SIGNATURE, BODY));
        assertFalse(verifier.verify(TIMESTAMP, null, BODY));
        assertFalse(verifier.verify("yesterday", SIGNATURE, BODY));
    }

    @Test
    void shouldPassEverythingWhenSecretMissing() {
        SlackRequestVerifier verifier = new SlackRequestVerifier("  ");

        assertFalse(verifier.isEnabled());
        assertTrue(verifier.verify(null, null, BODY));
    }
}
