/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.words;

/**
 * Outcome of {@link WordCache#insert(WordCategory, String)}.
 */
public enum InsertResult {
    INSERTED,
    ALREADY_PRESENT
}
