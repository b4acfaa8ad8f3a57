/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.words;

import com.insultbot.db.DatabaseManager;
import com.insultbot.db.SchemaInitializer;
import com.insultbot.utils.LoggerUtil;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * {@link RemoteWordStore} backed by the {@code insult_words} SQLite table.
 *
 * <p>The database location ({@code words.db.path}) is resolved on first use,
 * not at construction, so a missing setting surfaces as a
 * {@link WordCacheException.ConfigurationException} on the request that needs
 * the words rather than at startup.
 */
public class JdbcWordStore implements RemoteWordStore {

    public static final String DB_PATH_PROPERTY = "words.db.path";

    private static final String SELECT_ALL = "SELECT word, category FROM insult_words ORDER BY id";
    private static final String INSERT_ONE = "INSERT INTO insult_words (word, category) VALUES (?, ?)";

    private final Properties config;
    private volatile DatabaseManager databaseManager;

    public JdbcWordStore(Properties config) {
        this.config = config;
    }

    @Override
    public List<WordRecord> scan() {
        DatabaseManager db = database();
        List<WordRecord> records = new ArrayList<>();
        try (Connection conn = db.getDataSource().getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                records.add(new WordRecord(rs.getString("word"), rs.getString("category")));
            }
        } catch (SQLException e) {
            throw new WordCacheException.RemoteStoreException("scan", e);
        }
        LoggerUtil.debug(() -> "Scanned " + records.size() + " word records from " + db.getDbPath());
        return records;
    }

    @Override
    public void put(String word, WordCategory category) {
        DatabaseManager db = database();
        try (Connection conn = db.getDataSource().getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_ONE)) {

            stmt.setString(1, word);
            stmt.setString(2, category.getStoredTag());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new WordCacheException.RemoteStoreException("put", e);
        }
        LoggerUtil.info("Stored " + category.getStoredTag() + " '" + word + "'");
    }

    /**
     * Resolves the database on first use and makes sure the word table exists.
     */
    private DatabaseManager database() {
        DatabaseManager db = databaseManager;
        if (db != null) {
            return db;
        }
        synchronized (this) {
            if (databaseManager == null) {
                String dbPath = config == null ? null : config.getProperty(DB_PATH_PROPERTY);
                if (dbPath == null || dbPath.isBlank()) {
                    throw new WordCacheException.ConfigurationException(DB_PATH_PROPERTY);
                }
                DatabaseManager opened = DatabaseManager.getInstance(dbPath.trim());
                try {
                    SchemaInitializer.initializeSchema(opened);
                } catch (SQLException e) {
                    throw new WordCacheException.RemoteStoreException("schema setup", e);
                }
                databaseManager = opened;
            }
            return databaseManager;
        }
    }
}
