/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.words;

/**
 * Base exception for word cache and word store failures.
 */
public class WordCacheException extends RuntimeException {

    public WordCacheException(String message) {
        super(message);
    }

    public WordCacheException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when a required setting (such as the store location) is missing.
     */
    public static class ConfigurationException extends WordCacheException {
        private final String propertyName;

        public ConfigurationException(String propertyName) {
            super("Missing required configuration: " + propertyName);
            this.propertyName = propertyName;
        }

        public String getPropertyName() {
            return propertyName;
        }
    }

    /**
     * Thrown when reading from or writing to the word store fails.
     */
    public static class RemoteStoreException extends WordCacheException {
        public RemoteStoreException(String operation, Throwable cause) {
            super("Word store " + operation + " failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * Thrown on any access to a cache whose last insert failed part-way.
     * The cache contents can no longer be trusted; this is distinct from an empty cache.
     */
    public static class PoisonedCacheException extends WordCacheException {
        public PoisonedCacheException(Throwable cause) {
            super("Word cache is unusable after a failed update", cause);
        }
    }
}
