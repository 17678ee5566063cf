package com.purchasingpower.agentmail.model.flow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a conversation flow.
 *
 * <pre>
 * ACTIVE → WAITING → ACTIVE → ... → COMPLETED
 *   ↓         ↓
 * FAILED   TIMED_OUT
 * </pre>
 */
public enum FlowState {

    /**
     * Ready to execute a round.
     */
    ACTIVE("active"),

    /**
     * Suspended until a reply from the user or another agent arrives.
     */
    WAITING("waiting"),

    COMPLETED("completed"),

    /**
     * No reply arrived before the wait deadline.
     */
    TIMED_OUT("timed_out"),

    FAILED("failed");

    private final String value;

    FlowState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static FlowState fromValue(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (FlowState state : values()) {
            if (state.value.equals(normalized) || state.name().equalsIgnoreCase(normalized)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown flow state: " + raw);
    }

    /**
     * Terminal states never transition again.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == TIMED_OUT || this == FAILED;
    }
}
