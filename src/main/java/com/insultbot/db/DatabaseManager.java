/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.db;

import com.insultbot.utils.LoggerUtil;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Pooled SQLite access for the word store.
 *
 * <p>One pool exists per database file. The pool is small: the word table is
 * scanned once per process and afterwards only receives single-row inserts.
 */
public class DatabaseManager {
    private static DatabaseManager instance;
    private final HikariDataSource dataSource;
    private final String dbPath;

    private DatabaseManager(String dbPath) {
        this.dbPath = dbPath;

        createParentDirectoryIfNeeded(dbPath);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:sqlite:" + dbPath);
        config.setPoolName("insult-words");
        config.setMaximumPoolSize(4);
        config.setConnectionTimeout(10000); // bounds every store call
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);

        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("synchronous", "NORMAL");

        this.dataSource = new HikariDataSource(config);

        LoggerUtil.info("Word database pool initialized: " + dbPath);
    }

    /**
     * Gets the shared DatabaseManager for a database file, replacing the
     * current one if it points at a different file.
     *
     * @param dbPath Path to the SQLite database file
     * @return DatabaseManager instance
     */
    public static synchronized DatabaseManager getInstance(String dbPath) {
        if (instance == null || !instance.dbPath.equals(dbPath)) {
            if (instance != null) {
                instance.close();
            }
            instance = new DatabaseManager(dbPath);
        }
        return instance;
    }

    /**
     * Returns the current instance without creating one.
     *
     * @return the open DatabaseManager, or null if none was created yet
     */
    public static synchronized DatabaseManager peekInstance() {
        return instance;
    }

    public HikariDataSource getDataSource() {
        return dataSource;
    }

    public String getDbPath() {
        return dbPath;
    }

    private void createParentDirectoryIfNeeded(String dbPath) {
        Path parentDir = Paths.get(dbPath).getParent();
        if (parentDir == null) {
            return;
        }
        File dir = parentDir.toFile();
        if (!dir.exists()) {
            if (dir.mkdirs()) {
                LoggerUtil.info("Created database directory: " + parentDir);
            } else {
                LoggerUtil.warn("Failed to create database directory: " + parentDir);
            }
        }
    }

    /**
     * Closes the connection pool. Called from the shutdown hook.
     */
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            LoggerUtil.info("Word database pool closed");
        }
    }

    /**
     * Pool statistics for the health endpoint.
     *
     * @return String with pool statistics
     */
    public String getStats() {
        if (dataSource == null || dataSource.getHikariPoolMXBean() == null) {
            return "DatabaseManager not initialized";
        }

        return String.format("DB Pool - Active: %d, Idle: %d, Total: %d, Pending: %d",
            dataSource.getHikariPoolMXBean().getActiveConnections(),
            dataSource.getHikariPoolMXBean().getIdleConnections(),
            dataSource.getHikariPoolMXBean().getTotalConnections(),
            dataSource.getHikariPoolMXBean().getThreadsAwaitingConnection()
        );
    }
}
