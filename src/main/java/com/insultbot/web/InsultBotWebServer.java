/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.web;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.insultbot.db.DatabaseManager;
import com.insultbot.utils.LoggerUtil;
import com.insultbot.web.api.SharedErrorResponse;
import com.insultbot.web.api.SlackEventController;
import com.insultbot.words.LazyWordCache;
import io.javalin.Javalin;

/**
 * HTTP front end of the bot.
 * <p>
 * Receives Slack Events API callbacks and exposes a health check.
 */
public class InsultBotWebServer {
    private final SlackEventController slackEventController;
    private final LazyWordCache wordCache;
    private final Gson gson;
    private Javalin app;

    public InsultBotWebServer(SlackEventController slackEventController, LazyWordCache wordCache) {
        this.slackEventController = slackEventController;
        this.wordCache = wordCache;
        this.gson = new GsonBuilder().disableHtmlEscaping().create();
    }

    /**
     * Starts the web server on the specified port.
     *
     * @param port Port to bind the server to, 0 for any free port
     */
    public void start(int port) {
        app = Javalin.create(javalinConfig -> {
            javalinConfig.jsonMapper(new GsonJsonMapper(gson));
            javalinConfig.showJavalinBanner = false;

            if (LoggerUtil.isDebugEnabled()) {
                javalinConfig.bundledPlugins.enableDevLogging();
            }
        });

        configureRoutes();
        configureErrorHandlers();

        app.start(port);
        LoggerUtil.info("Insult bot web server started on port " + app.port());
    }

    /**
     * Stops the web server.
     */
    public void stop() {
        if (app != null) {
            app.stop();
            LoggerUtil.info("Insult bot web server stopped");
        }
    }

    /**
     * @return the bound port, or -1 before {@link #start(int)}
     */
    public int port() {
        return app == null ? -1 : app.port();
    }

    private void configureRoutes() {
        app.get("/api/health", ctx -> {
            DatabaseManager db = DatabaseManager.peekInstance();
            String dbStats = db == null ? "not opened" : db.getStats();
            boolean loaded = wordCache.isLoaded();
            boolean poisoned = loaded && wordCache.get().isPoisoned();
            ctx.json(new HealthResponse(poisoned ? "DEGRADED" : "OK", System.currentTimeMillis(), dbStats,
                    loaded, poisoned));
        });

        app.post("/slack/events", slackEventController::handleEvent);
    }

    /**
     * Configures error handlers for JSON error responses.
     */
    private void configureErrorHandlers() {
        app.exception(Exception.class, (e, ctx) -> {
            LoggerUtil.error("Unhandled exception in web request " + ctx.path(), e);
            ctx.status(500).json(SharedErrorResponse.serverError("Internal server error"));
        });

        app.error(404, ctx -> ctx.json(SharedErrorResponse.notFound("No route for " + ctx.path())));
    }

    /**
     * Response record for health check endpoint.
     */
    private record HealthResponse(String status, long timestamp, String dbStats, boolean wordCacheLoaded,
                                  boolean wordCachePoisoned) {
    }
}
