package com.purchasingpower.agentmail.model.flow;

import java.util.Locale;

/**
 * What the agent wants to happen after a round.
 */
public enum RoundDecision {
    CONTINUE,
    WAIT_FOR_USER,
    WAIT_FOR_AGENT,
    COMPLETE,
    FAIL;

    /**
     * Parses a model-produced decision. Returns {@code null} for anything unrecognized.
     */
    public static RoundDecision parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (RoundDecision decision : values()) {
            if (decision.name().equals(normalized)) {
                return decision;
            }
        }
        return null;
    }

    /**
     * Decisions that close the flow.
     */
    public boolean isFinal() {
        return this == COMPLETE || this == FAIL;
    }
}
