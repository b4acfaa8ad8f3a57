/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot;

import com.insultbot.command.CommandDispatcher;
import com.insultbot.command.CommandRouter;
import com.insultbot.db.DatabaseManager;
import com.insultbot.slack.SlackEventParser;
import com.insultbot.slack.SlackReplySink;
import com.insultbot.slack.SlackRequestVerifier;
import com.insultbot.utils.LoggerUtil;
import com.insultbot.web.InsultBotWebServer;
import com.insultbot.web.api.SlackEventController;
import com.insultbot.words.JdbcWordStore;
import com.insultbot.words.LazyWordCache;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Launcher for the insult bot.
 *
 * Loads configuration, wires the word store, cache, command dispatcher and
 * Slack adapters, and serves the Events API webhook until the JVM exits.
 * The word store is not touched at startup; the first command loads it.
 */
public class InsultBotApplication {

    /** Environment variables that override properties of the same meaning. */
    static final Map<String, String> ENV_OVERRIDES = Map.of(
            "SLACK_TOKEN", "slack.bot.token",
            "SLACK_SIGNING_SECRET", "slack.signing.secret",
            "INSULT_DB_PATH", JdbcWordStore.DB_PATH_PROPERTY);

    private static InsultBotWebServer webServer;
    private static ExecutorService eventExecutor;
    private static ExecutorService persistenceExecutor;
    private static final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public static void main(String[] args) {
        try {
            Properties config = loadConfiguration(System.getenv());
            LoggerUtil.setDebugEnabled(Boolean.parseBoolean(config.getProperty("log.debug", "false")));

            startWebServer(config);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LoggerUtil.info("Shutting down insult bot...");
                shutdown();
            }));

            LoggerUtil.info("Insult bot started");
            shutdownLatch.await();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LoggerUtil.error("Insult bot interrupted");
        } catch (Exception e) {
            LoggerUtil.error("Failed to start insult bot", e);
            System.exit(1);
        }
    }

    private static void startWebServer(Properties config) {
        int webPort = parseInt(config, "web.port", 5300);
        int eventThreads = parseInt(config, "bot.event.threads", 4);
        int persistThreads = parseInt(config, "words.persist.threads", 2);

        eventExecutor = Executors.newFixedThreadPool(eventThreads, namedThreads("slack-event"));
        persistenceExecutor = Executors.newFixedThreadPool(persistThreads, namedThreads("word-persist"));

        JdbcWordStore wordStore = new JdbcWordStore(config);
        LazyWordCache wordCache = LazyWordCache.over(wordStore);
        CommandDispatcher dispatcher = new CommandDispatcher(
                new CommandRouter(), wordCache, wordStore, new SlackReplySink(config), persistenceExecutor);

        SlackEventController controller = new SlackEventController(
                new SlackEventParser(),
                new SlackRequestVerifier(config.getProperty("slack.signing.secret", "")),
                dispatcher,
                eventExecutor,
                Boolean.parseBoolean(config.getProperty("slack.skip.mention.messages", "true")));

        webServer = new InsultBotWebServer(controller, wordCache);
        webServer.start(webPort);
        LoggerUtil.info("Slack events endpoint: http://localhost:" + webServer.port() + "/slack/events");
    }

    /**
     * Loads configuration from the classpath {@code application.properties},
     * then an optional external {@code resources/application.properties},
     * then the environment.
     *
     * @param env environment variables to apply last
     * @return merged configuration
     * @throws IOException if the classpath defaults are missing or unreadable
     */
    public static Properties loadConfiguration(Map<String, String> env) throws IOException {
        Properties config = new Properties();

        try (InputStream inputStream = InsultBotApplication.class.getClassLoader()
                .getResourceAsStream("application.properties")) {

            if (inputStream == null) {
                throw new IOException("application.properties not found in classpath");
            }
            config.load(inputStream);
        }

        // External file for container deployments
        Path externalConfigPath = Paths.get("resources", "application.properties");
        if (Files.exists(externalConfigPath)) {
            LoggerUtil.info("Loading configuration overrides from " + externalConfigPath.toAbsolutePath());
            try (InputStream inputStream = Files.newInputStream(externalConfigPath)) {
                Properties externalConfig = new Properties();
                externalConfig.load(inputStream);
                config.putAll(externalConfig);
            } catch (IOException e) {
                LoggerUtil.warn("Failed to load external configuration overrides: " + e.getMessage());
            }
        }

        applyEnvironment(config, env);
        return config;
    }

    static void applyEnvironment(Properties config, Map<String, String> env) {
        if (env == null) {
            return;
        }
        ENV_OVERRIDES.forEach((variable, property) -> {
            String value = env.get(variable);
            if (value != null && !value.isBlank()) {
                config.setProperty(property, value.trim());
                LoggerUtil.info("Using " + variable + " for " + property);
            }
        });
    }

    private static int parseInt(Properties config, String key, int defaultValue) {
        String value = config.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LoggerUtil.warn("Invalid " + key + " value: " + value + ", using default: " + defaultValue);
            return defaultValue;
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static void shutdown() {
        try {
            if (webServer != null) {
                webServer.stop();
            }
            shutdownExecutor(eventExecutor);
            shutdownExecutor(persistenceExecutor);

            DatabaseManager databaseManager = DatabaseManager.peekInstance();
            if (databaseManager != null) {
                databaseManager.close();
            }
            LoggerUtil.info("Insult bot shutdown complete");
        } catch (RuntimeException e) {
            LoggerUtil.error("Error during shutdown", e);
        } finally {
            shutdownLatch.countDown();
        }
    }

    private static void shutdownExecutor(ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LoggerUtil.warn("Executor did not finish pending work, dropping it");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
