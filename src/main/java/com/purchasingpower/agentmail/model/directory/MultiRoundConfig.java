package com.purchasingpower.agentmail.model.directory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MultiRoundConfig {

    /**
     * Null means "use app.flow.default-max-rounds".
     */
    private Integer maxRounds;

    /**
     * Null means "use app.flow.default-timeout-minutes".
     */
    private Integer timeoutMinutes;

    private boolean canCommunicateWithAgents;

    /**
     * Usernames this agent may delegate to. Empty means any known agent.
     */
    @Builder.Default
    private List<String> allowedAgentUsernames = new ArrayList<>();
}
