/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.words;

import java.util.List;

/**
 * Durable backing store of every known word.
 *
 * <p>Implementations own their own timeouts and report every failure as a
 * {@link WordCacheException}: {@link WordCacheException.ConfigurationException}
 * when the store location is not configured, otherwise
 * {@link WordCacheException.RemoteStoreException}.
 */
public interface RemoteWordStore {

    /**
     * Lists every stored record, malformed ones included.
     *
     * @return all records, in storage order
     * @throws WordCacheException if the store cannot be read
     */
    List<WordRecord> scan();

    /**
     * Appends one record. Not idempotent: a retried put may leave a duplicate row.
     *
     * @param word     the trimmed word
     * @param category its category
     * @throws WordCacheException if the record cannot be written
     */
    void put(String word, WordCategory category);
}
