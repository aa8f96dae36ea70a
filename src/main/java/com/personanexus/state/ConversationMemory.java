/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, ordered conversation history for one scope (oldest first).
 *
 * <p>Mutations return a new instance; callers replace the stored value atomically.
 */
public final class ConversationMemory {

    private static final ConversationMemory EMPTY = new ConversationMemory(List.of());

    private final List<Turn> turns;

    @JsonCreator
    public ConversationMemory(@JsonProperty("turns") List<Turn> turns) {
        this.turns = turns == null ? List.of() : List.copyOf(turns);
    }

    public static ConversationMemory empty() {
        return EMPTY;
    }

    @JsonProperty("turns")
    public List<Turn> getTurns() {
        return turns;
    }

    @JsonIgnore
    public int size() {
        return turns.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return turns.isEmpty();
    }

    @JsonIgnore
    public Optional<Turn> getLastTurn() {
        return turns.isEmpty() ? Optional.empty() : Optional.of(turns.get(turns.size() - 1));
    }

    /**
     * Append a turn, then drop the oldest turns until at most {@code maxTurns} remain.
     */
    public ConversationMemory append(Turn turn, int maxTurns) {
        Objects.requireNonNull(turn, "turn");
        List<Turn> next = new ArrayList<>(turns.size() + 1);
        next.addAll(turns);
        next.add(turn);
        return new ConversationMemory(tail(next, maxTurns));
    }

    /**
     * Keep only the most recent {@code maxTurns} turns.
     */
    public ConversationMemory truncate(int maxTurns) {
        if (turns.size() <= maxTurns) {
            return this;
        }
        return new ConversationMemory(tail(turns, maxTurns));
    }

    private static List<Turn> tail(List<Turn> list, int maxTurns) {
        if (maxTurns < 1) {
            throw new IllegalArgumentException("maxTurns must be positive: " + maxTurns);
        }
        if (list.size() <= maxTurns) {
            return list;
        }
        return list.subList(list.size() - maxTurns, list.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConversationMemory)) return false;
        return turns.equals(((ConversationMemory) o).turns);
    }

    @Override
    public int hashCode() {
        return turns.hashCode();
    }

    @Override
    public String toString() {
        return "ConversationMemory{turns=" + turns.size() + "}";
    }
}
