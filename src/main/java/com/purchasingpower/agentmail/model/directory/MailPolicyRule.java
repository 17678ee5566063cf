package com.purchasingpower.agentmail.model.directory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Who an agent may exchange mail with, per direction.
 */
public enum MailPolicyRule {

    /**
     * Anyone.
     */
    ANY("any"),

    /**
     * Members of the agent's team and any known agent.
     */
    TEAM_AND_AGENTS("team_and_agents"),

    /**
     * Members of the agent's team only.
     */
    TEAM_ONLY("team_only"),

    /**
     * Known agents only.
     */
    AGENTS_ONLY("agents_only");

    public static final MailPolicyRule DEFAULT = TEAM_AND_AGENTS;

    private final String value;

    MailPolicyRule(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient parse: unknown, blank or null values fall back to {@link #DEFAULT}.
     */
    @JsonCreator
    public static MailPolicyRule fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (MailPolicyRule rule : values()) {
            if (rule.value.equals(normalized)) {
                return rule;
            }
        }
        return DEFAULT;
    }

    public boolean allowsTeamMembers() {
        return this == TEAM_AND_AGENTS || this == TEAM_ONLY;
    }

    public boolean allowsKnownAgents() {
        return this == TEAM_AND_AGENTS || this == AGENTS_ONLY;
    }
}
