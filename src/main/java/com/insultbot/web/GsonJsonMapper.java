/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.web;

import com.google.gson.Gson;
import io.javalin.json.JsonMapper;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Type;

/**
 * Gson-based JSON mapper for Javalin responses.
 *
 * <p>Only serialization is provided. Slack request bodies are read raw with
 * {@code ctx.body()} because the signature covers the exact bytes, and are
 * decoded by {@link com.insultbot.slack.SlackEventParser}.
 */
public class GsonJsonMapper implements JsonMapper {
    private final Gson gson;

    public GsonJsonMapper(Gson gson) {
        this.gson = gson;
    }

    @NotNull
    @Override
    public String toJsonString(@NotNull Object obj, @NotNull Type type) {
        return gson.toJson(obj, type);
    }
}
