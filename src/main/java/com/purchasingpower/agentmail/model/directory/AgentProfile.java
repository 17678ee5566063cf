package com.purchasingpower.agentmail.model.directory;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Read-only view of a configured agent.
 */
@Value
@Builder
public class AgentProfile {

    String id;

    /**
     * Local part of the agent's mail address.
     */
    String username;

    String name;

    String teamId;

    /**
     * Persona prompt prepended to every round.
     */
    String prompt;

    @Builder.Default
    List<String> tools = List.of();

    @Builder.Default
    MailPolicyConfig mailPolicy = new MailPolicyConfig();

    @Builder.Default
    MultiRoundConfig multiRound = new MultiRoundConfig();

    public String displayName() {
        return name == null || name.isBlank() ? username : name;
    }
}
