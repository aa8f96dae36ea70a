/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.utils;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.function.Supplier;

/**
 * Process-wide console logger.
 *
 * <p>Lines are written as {@code [timestamp][LEVEL] message}. Debug output is off
 * unless enabled via {@code logging.debug=true}; tests switch everything off with
 * {@link #setSilent(boolean)}.
 */
public final class LoggerUtil {
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
    private static volatile boolean silent = false;
    private static volatile boolean debugEnabled = false;

    public static void log(String level, String msg) {
        if (silent) return;
        String line = "[" + TS.format(LocalDateTime.now()) + "][" + level + "] " + msg;
        System.out.println(line);
    }

    public static void info(String msg) { log("INFO", msg); }
    public static void warn(String msg) { log("WARN", msg); }
    public static void error(String msg) { log("ERROR", msg); }

    /**
     * Logs an error together with the stack trace of its cause.
     */
    public static void error(String msg, Throwable cause) {
        if (silent) return;
        if (cause == null) {
            error(msg);
            return;
        }
        StringWriter trace = new StringWriter();
        cause.printStackTrace(new PrintWriter(trace));
        log("ERROR", msg + System.lineSeparator() + trace);
    }

    public static void debug(String msg) { if (debugEnabled) log("DEBUG", msg); }
    public static void debug(Supplier<String> msgSupplier) {
        if (debugEnabled && !silent) {
            log("DEBUG", msgSupplier.get());
        }
    }
    public static boolean isDebugEnabled() { return debugEnabled && !silent; }
    public static void setDebugEnabled(boolean enabled) { debugEnabled = enabled; }

    public static void setSilent(boolean silent) { LoggerUtil.silent = silent; }

    /**
     * Shortens text for single-line log output.
     *
     * @param text the text to shorten (may be null)
     * @param maxLength maximum characters kept before the ellipsis
     * @return the shortened text, or "null"
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "null";
        }
        String flat = text.replace('\n', ' ');
        if (flat.length() <= maxLength) {
            return flat;
        }
        return flat.substring(0, maxLength) + "...";
    }

    private LoggerUtil() {}
}
