/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.web.api;

/**
 * Error body returned by the web endpoints.
 */
public record SharedErrorResponse(String error, String message) {

    public static SharedErrorResponse unauthorized(String message) {
        return new SharedErrorResponse("Unauthorized", message);
    }

    public static SharedErrorResponse notFound(String message) {
        return new SharedErrorResponse("Not found", message);
    }

    public static SharedErrorResponse serverError(String message) {
        return new SharedErrorResponse("Server error", message);
    }
}
