/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.admin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.personanexus.utils.JacksonConfig;
import com.personanexus.utils.LoggerUtil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Properties;

/**
 * Bounded record of admin actions and auto-replies.
 *
 * <p>The newest {@code capacity} entries are kept in memory. When a log file is
 * configured every entry is also appended to it as one JSON object per line.
 */
public class AuditTrail {

    public static final int DEFAULT_CAPACITY = 200;

    private final int capacity;
    private final Path logFile;
    private final Deque<AuditEntry> entries = new ArrayDeque<>();

    public AuditTrail(int capacity) {
        this(capacity, null);
    }

    public AuditTrail(int capacity, Path logFile) {
        if (capacity < 1) {
            throw new IllegalArgumentException("audit.capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
        this.logFile = logFile;
    }

    /**
     * Reads {@code audit.capacity} and {@code audit.log.file} (blank disables the file).
     */
    public static AuditTrail fromProperties(Properties properties) {
        int capacity = Integer.parseInt(properties.getProperty("audit.capacity", String.valueOf(DEFAULT_CAPACITY)).trim());
        String file = properties.getProperty("audit.log.file", "").trim();
        return new AuditTrail(capacity, file.isEmpty() ? null : Path.of(file));
    }

    public void record(AuditEntry entry) {
        synchronized (entries) {
            entries.addLast(entry);
            while (entries.size() > capacity) {
                entries.removeFirst();
            }
        }
        LoggerUtil.info("[Audit] " + entry.type() + " " + entry.scope() + " by " + entry.actor() + ": " + entry.summary());
        appendToFile(entry);
    }

    /**
     * @param limit maximum number of entries to return
     * @return most recent entries, newest first
     */
    public List<AuditEntry> recent(int limit) {
        List<AuditEntry> result = new ArrayList<>();
        synchronized (entries) {
            Iterator<AuditEntry> it = entries.descendingIterator();
            while (it.hasNext() && result.size() < limit) {
                result.add(it.next());
            }
        }
        return result;
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    private void appendToFile(AuditEntry entry) {
        if (logFile == null) {
            return;
        }
        try {
            String line = JacksonConfig.mapper().writeValueAsString(entry) + System.lineSeparator();
            synchronized (this) {
                Path parent = logFile.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(logFile, line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            }
        } catch (JsonProcessingException e) {
            LoggerUtil.warn("[Audit] Could not encode entry: " + e.getOriginalMessage());
        } catch (IOException e) {
            LoggerUtil.warn("[Audit] Could not append to " + logFile + ": " + e.getMessage());
        }
    }
}
