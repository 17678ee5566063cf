package com.purchasingpower.agentmail.model.flow;

import lombok.Builder;
import lombok.Value;

/**
 * Where a flow stands after {@code executeRound} returns.
 */
@Value
@Builder
public class RoundResult {
    String flowId;
    FlowState state;
    int round;
    RoundDecision decision;
    boolean overridden;
    String reasoning;

    public static RoundResult of(ConversationFlow flow, RoundDecision decision, boolean overridden, String reasoning) {
        return RoundResult.builder()
                .flowId(flow.getId())
                .state(flow.getState())
                .round(flow.getRound())
                .decision(decision)
                .overridden(overridden)
                .reasoning(reasoning)
                .build();
    }
}
