/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.db;

import com.insultbot.utils.LoggerUtil;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the word store schema.
 *
 * <p>Words carry an explicit category column ({@code descriptor} or
 * {@code subject}). {@code word} has no uniqueness constraint; duplicates
 * are filtered in memory before a row is written.
 */
public class SchemaInitializer {

    public static final String WORDS_TABLE = "insult_words";

    /**
     * Creates the word table and its index if they don't exist.
     * Safe to call multiple times.
     *
     * @param databaseManager Database connection manager
     * @throws SQLException if schema creation fails
     */
    public static void initializeSchema(DatabaseManager databaseManager) throws SQLException {
        try (Connection conn = databaseManager.getDataSource().getConnection();
             Statement stmt = conn.createStatement()) {

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS insult_words (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    word TEXT NOT NULL,
                    category TEXT NOT NULL,
                    created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                )
            """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_insult_words_category ON insult_words(category)");

            LoggerUtil.debug("Word store schema ready");
        }
    }

    /**
     * Checks whether the word table exists.
     *
     * @param databaseManager Database connection manager
     * @return true if the table exists
     */
    public static boolean isSchemaInitialized(DatabaseManager databaseManager) {
        try (Connection conn = databaseManager.getDataSource().getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                 "SELECT name FROM sqlite_master WHERE type='table' AND name='" + WORDS_TABLE + "'")) {
            return rs.next();
        } catch (SQLException e) {
            LoggerUtil.warn("Failed to check word store schema: " + e.getMessage());
            return false;
        }
    }
}
