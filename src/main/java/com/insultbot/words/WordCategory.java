/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.words;

import java.util.Locale;
import java.util.Optional;

/**
 * The two roles a word can play in a phrase.
 *
 * <p>Each category has a stored tag (the value of the word store's
 * {@code category} column) and the keyword users type in an add-word command.
 */
public enum WordCategory {
    DESCRIPTOR("descriptor", "adjective"),
    SUBJECT("subject", "noun");

    private final String storedTag;
    private final String commandKeyword;

    WordCategory(String storedTag, String commandKeyword) {
        this.storedTag = storedTag;
        this.commandKeyword = commandKeyword;
    }

    public String getStoredTag() {
        return storedTag;
    }

    public String getCommandKeyword() {
        return commandKeyword;
    }

    /**
     * Resolves a stored category tag. Matching ignores case and surrounding whitespace.
     *
     * @param tag the raw column value (may be null)
     * @return the category, or empty for null or unrecognized tags
     */
    public static Optional<WordCategory> fromStoredTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (WordCategory category : values()) {
            if (category.storedTag.equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves the keyword of an add-word command ({@code adjective} or {@code noun}).
     *
     * @param keyword the keyword as typed
     * @return the category, or empty if the keyword is not recognized
     */
    public static Optional<WordCategory> fromCommandKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        String normalized = keyword.trim().toLowerCase(Locale.ROOT);
        for (WordCategory category : values()) {
            if (category.commandKeyword.equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
