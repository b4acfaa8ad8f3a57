/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.insultbot.utils;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.function.Supplier;

/**
 * Static logging facade used across the bot.
 *
 * <p>Lines are written to stdout as {@code [timestamp][LEVEL][thread] message}.
 * Event handling and word persistence run on pooled threads, so the thread
 * name is part of every line.
 */
public final class LoggerUtil {
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
    private static volatile boolean silent = false;
    private static volatile boolean debugEnabled = false;

    public static void log(String level, String msg) {
        if (silent) return;
        String line = "[" + TS.format(LocalDateTime.now()) + "][" + level + "]["
                + Thread.currentThread().getName() + "] " + msg;
        System.out.println(line);
    }

    public static void info(String msg) { log("INFO", msg); }
    public static void warn(String msg) { log("WARN", msg); }
    public static void error(String msg) { log("ERROR", msg); }
    public static void debug(String msg) { if (debugEnabled) log("DEBUG", msg); }
    public static void debug(Supplier<String> msgSupplier) {
        if (debugEnabled && !silent) {
            log("DEBUG", msgSupplier.get());
        }
    }

    /**
     * Logs an error together with the failing exception's type and message.
     *
     * @param msg   what was being attempted
     * @param cause the failure (may be null)
     */
    public static void error(String msg, Throwable cause) {
        if (cause == null) {
            error(msg);
            return;
        }
        error(msg + ": " + cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    public static boolean isDebugEnabled() { return debugEnabled && !silent; }
    public static void setDebugEnabled(boolean enabled) { debugEnabled = enabled; }

    public static void setSilent(boolean silent) { LoggerUtil.silent = silent; }

    private LoggerUtil() {}
}
