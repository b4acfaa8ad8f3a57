/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.command;

import com.insultbot.words.WordCategory;

/**
 * Classification of one inbound message, produced by {@link CommandRouter}.
 */
public interface CommandMatch {

    /**
     * Insult someone. {@code target} is a ready-to-send mention token such as {@code <@U123>}.
     */
    record InsultRequest(String target) implements CommandMatch {
    }

    /**
     * Add a word to a category. {@code word} is already trimmed and non-empty.
     */
    record AddWord(WordCategory category, String word) implements CommandMatch {
    }

    /**
     * An add-word command whose word was empty after trimming.
     */
    record RejectedAddWord(WordCategory category) implements CommandMatch {
    }

    /**
     * Ordinary chat text.
     */
    record NoMatch() implements CommandMatch {
    }

    NoMatch NO_MATCH = new NoMatch();
}
