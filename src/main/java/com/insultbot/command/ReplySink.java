/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.command;

/**
 * Delivers a text reply to a chat channel.
 *
 * <p>Delivery is fire-and-forget. Implementations log their own failures and
 * never retry; callers still guard against runtime exceptions.
 */
@FunctionalInterface
public interface ReplySink {

    /**
     * @param channel destination channel id
     * @param text    reply text
     */
    void send(String channel, String text);
}
