package com.purchasingpower.agentmail.agent;

import com.purchasingpower.agentmail.model.flow.ToolCallRecord;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What the agent produced in one round: its final decision and the tool calls that led to it.
 */
@Value
@Builder
public class RoundOutcome {
    ModelDecision decision;

    @Builder.Default
    List<ToolCallRecord> toolCalls = List.of();
}
