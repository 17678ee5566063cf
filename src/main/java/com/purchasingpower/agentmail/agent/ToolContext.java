package com.purchasingpower.agentmail.agent;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Context provided to tools during execution.
 */
@Value
@Builder
public class ToolContext {
    String flowId;
    String agentId;
    String teamId;
    String userId;

    /**
     * Tool names the agent is configured with.
     */
    @Builder.Default
    Set<String> allowedTools = Set.of();
}
