/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.command;

import com.insultbot.utils.LoggerUtil;
import com.insultbot.words.WordCategory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes the bot's text commands.
 *
 * <p><b>Grammar</b> (keywords case-insensitive, checked in this order, first match wins):
 * <ol>
 *   <li>{@code [<@BOT>] insult <@USER>} - insult the mentioned user</li>
 *   <li>{@code ... insult me} - insult the sender; "insult me" must end the message</li>
 *   <li>{@code [<@BOT>] add adjective|noun WORDS} - add a word; WORDS may hold
 *       letters, digits, underscores, spaces, commas and hyphens</li>
 * </ol>
 *
 * <p>Every pattern is anchored to the end of the message, so chat that merely
 * contains these words ("don't insult measurements") is not a command.
 */
public class CommandRouter {

    private static final String MENTION = "<@[A-Za-z0-9]+(?:\\|[^>]*)?>";
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final Pattern INSULT_TARGET_PATTERN = Pattern.compile(
            "^\\s*(?:" + MENTION + "\\s*)?insult\\s+(" + MENTION + ")[\\s.!?]*$", FLAGS);

    private static final Pattern INSULT_ME_PATTERN = Pattern.compile(
            "\\binsult\\s+me\\b[\\s.!?]*$", FLAGS);

    private static final Pattern ADD_WORD_PATTERN = Pattern.compile(
            "^\\s*(?:" + MENTION + "\\s*)?add\\s+(adjective|noun)(?:\\s+([\\w ,-]*))?\\s*$", FLAGS);

    /**
     * Classifies a message.
     *
     * @param messageText the raw message text (may be null)
     * @param requesterId the sender's user id, used for "insult me"
     * @return the match; never null
     */
    public CommandMatch classify(String messageText, String requesterId) {
        if (messageText == null || messageText.isBlank()) {
            return CommandMatch.NO_MATCH;
        }

        Matcher target = INSULT_TARGET_PATTERN.matcher(messageText);
        if (target.matches()) {
            return new CommandMatch.InsultRequest(target.group(1));
        }

        if (INSULT_ME_PATTERN.matcher(messageText).find()) {
            return new CommandMatch.InsultRequest(toUserTag(requesterId));
        }

        Matcher add = ADD_WORD_PATTERN.matcher(messageText);
        if (add.matches()) {
            Optional<WordCategory> category = WordCategory.fromCommandKeyword(add.group(1));
            if (category.isEmpty()) {
                return CommandMatch.NO_MATCH;
            }
            String word = add.group(2) == null ? "" : add.group(2).trim();
            if (word.isEmpty()) {
                LoggerUtil.debug(() -> "Rejected empty add-word command from " + requesterId);
                return new CommandMatch.RejectedAddWord(category.get());
            }
            return new CommandMatch.AddWord(category.get(), word);
        }

        return CommandMatch.NO_MATCH;
    }

    /**
     * Formats a user id as a Slack mention token.
     *
     * @param userId Slack user id such as {@code U123}
     * @return {@code <@U123>}
     */
    public static String toUserTag(String userId) {
        return "<@" + userId + ">";
    }
}
