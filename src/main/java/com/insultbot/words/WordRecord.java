/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.words;

/**
 * One raw record from the word store. Both fields may be null; nothing is
 * validated until the cache is built from the records.
 */
public record WordRecord(String word, String category) {
}
