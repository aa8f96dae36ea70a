/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.engine;

import com.personanexus.utils.LoggerUtil;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local set of message ids currently being handled.
 *
 * <p>A platform may deliver the same message more than once (reconnects, retries).
 * Only the first delivery is admitted; later ones are rejected until the first
 * releases its id. Ids are not remembered after release.
 */
public class ReentrancyGuard {

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * @return true if the id was not in flight and is now admitted
     */
    public boolean tryAdmit(String messageId) {
        boolean admitted = inFlight.add(messageId);
        if (!admitted) {
            LoggerUtil.debug(() -> "[ReentrancyGuard] Duplicate delivery skipped: " + messageId);
        }
        return admitted;
    }

    /**
     * Remove an id. Releasing an id that is not in flight does nothing.
     */
    public void release(String messageId) {
        inFlight.remove(messageId);
    }

    /**
     * Admit an id for the duration of a try-with-resources block.
     *
     * @return the admission, or empty if the id is already in flight
     */
    public Optional<Admission> admit(String messageId) {
        return tryAdmit(messageId) ? Optional.of(new Admission(messageId)) : Optional.empty();
    }

    public boolean isInFlight(String messageId) {
        return inFlight.contains(messageId);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Releases its message id when closed. Closing twice is harmless.
     */
    public final class Admission implements AutoCloseable {
        private final String messageId;
        private volatile boolean closed;

        private Admission(String messageId) {
            this.messageId = messageId;
        }

        public String messageId() {
            return messageId;
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                release(messageId);
            }
        }
    }
}
