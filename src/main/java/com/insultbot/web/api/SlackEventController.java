/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.web.api;

import com.insultbot.command.CommandDispatcher;
import com.insultbot.command.CommandMatch;
import com.insultbot.slack.MessageEvent;
import com.insultbot.slack.SlackEnvelope;
import com.insultbot.slack.SlackEventParser;
import com.insultbot.slack.SlackRequestVerifier;
import com.insultbot.utils.LoggerUtil;
import com.insultbot.words.WordCacheException;
import io.javalin.http.Context;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Controller for the Slack Events API webhook.
 * POST /slack/events
 *
 * <p>Answers the url_verification handshake and acknowledges event callbacks
 * immediately. Message events are dispatched on the event executor, because
 * Slack expects an answer within three seconds and the first command loads
 * the whole word store.
 */
public class SlackEventController {

    static final String RETRY_HEADER = "X-Slack-Retry-Num";

    private final SlackEventParser parser;
    private final SlackRequestVerifier verifier;
    private final CommandDispatcher dispatcher;
    private final Executor eventExecutor;
    private final boolean skipShadowedMessages;

    public SlackEventController(SlackEventParser parser, SlackRequestVerifier verifier,
                                CommandDispatcher dispatcher, Executor eventExecutor) {
        this(parser, verifier, dispatcher, eventExecutor, true);
    }

    /**
     * @param skipShadowedMessages drop {@code message} events that mention the app, because the
     *                             same text also arrives as an {@code app_mention}. Turn off only
     *                             when the app is not subscribed to {@code app_mention}.
     */
    public SlackEventController(SlackEventParser parser, SlackRequestVerifier verifier,
                                CommandDispatcher dispatcher, Executor eventExecutor,
                                boolean skipShadowedMessages) {
        this.parser = parser;
        this.verifier = verifier;
        this.dispatcher = dispatcher;
        this.eventExecutor = eventExecutor;
        this.skipShadowedMessages = skipShadowedMessages;
    }

    /**
     * Handles one Events API request.
     * POST /slack/events
     */
    public void handleEvent(Context ctx) {
        String body = ctx.body();

        if (!verifier.verify(ctx.header(SlackRequestVerifier.TIMESTAMP_HEADER),
                ctx.header(SlackRequestVerifier.SIGNATURE_HEADER), body)) {
            ctx.status(401).json(SharedErrorResponse.unauthorized("Invalid Slack request signature"));
            return;
        }

        SlackEnvelope envelope;
        try {
            envelope = parser.parse(body);
        } catch (SlackEventParser.MalformedEnvelopeException e) {
            LoggerUtil.warn("Ignoring malformed Slack payload: " + e.getMessage());
            ctx.json(new EnvelopeErrorResponse(e.getMessage()));
            return;
        }

        LoggerUtil.debug(() -> "Slack envelope type " + envelope.type());

        if (envelope.isUrlVerification()) {
            LoggerUtil.info("Answering Slack url_verification challenge");
            ctx.json(new ChallengeResponse(envelope.challenge()));
            return;
        }

        if (envelope.isEventCallback() && envelope.hasMessageEvent()) {
            String retryNum = ctx.header(RETRY_HEADER);
            if (retryNum != null) {
                LoggerUtil.info("Skipping Slack redelivery #" + retryNum + " of message " + envelope.event().ts());
            } else if (skipShadowedMessages && envelope.isShadowedByAppMention()) {
                LoggerUtil.debug(() -> "Leaving message " + envelope.event().ts() + " to its app_mention copy");
            } else if (envelope.event().isDispatchable()) {
                submit(envelope.event());
            } else {
                LoggerUtil.debug(() -> "Ignoring non-user message event " + envelope.event().ts());
            }
        }

        ctx.json(new AckResponse(true));
    }

    private void submit(MessageEvent event) {
        try {
            eventExecutor.execute(() -> process(event));
        } catch (RejectedExecutionException e) {
            LoggerUtil.error("Event executor rejected message " + event.ts(), e);
        }
    }

    /**
     * Runs the dispatcher for one event. Failures are logged only; nothing is
     * said in the channel about internal errors.
     */
    private void process(MessageEvent event) {
        long startTime = System.currentTimeMillis();
        try {
            CommandMatch match = dispatcher.dispatch(event.text(), event.user(), event.channel());
            if (!(match instanceof CommandMatch.NoMatch)) {
                LoggerUtil.info(String.format("Handled %s from %s in %dms",
                        match.getClass().getSimpleName(), event.user(), System.currentTimeMillis() - startTime));
            }
        } catch (WordCacheException e) {
            LoggerUtil.error("Dropping message " + event.ts() + " from " + event.user(), e);
        } catch (RuntimeException e) {
            LoggerUtil.error("Unexpected failure handling message " + event.ts(), e);
        }
    }

    /** Response for the url_verification handshake. */
    public record ChallengeResponse(String challenge) {
    }

    /** Acknowledgement for every accepted callback. */
    public record AckResponse(boolean ok) {
    }

    /** Body returned (with status 200) for payloads that are not Slack envelopes. */
    public record EnvelopeErrorResponse(String error) {
    }
}
