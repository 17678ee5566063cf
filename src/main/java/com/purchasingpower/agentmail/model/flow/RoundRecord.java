package com.purchasingpower.agentmail.model.flow;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.purchasingpower.agentmail.model.mail.Email;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * One completed round. Appended to the flow history and never modified.
 */
@Value
@Builder
@Jacksonized
public class RoundRecord {

    /**
     * Zero-based; equals the flow's round counter before the round ran.
     */
    int index;

    RoundInputKind inputKind;

    /**
     * Message processed in this round, absent for continuation rounds.
     */
    Email input;

    @Builder.Default
    List<ToolCallRecord> toolCalls = List.of();

    /**
     * Decision that took effect.
     */
    RoundDecision decision;

    /**
     * Decision the agent asked for when it was overridden (round budget, policy).
     */
    RoundDecision requestedDecision;

    String reasoning;

    /**
     * Text sent to the requester or target agent, if any.
     */
    String reply;

    Instant timestamp;

    @JsonIgnore
    public boolean isOverridden() {
        return requestedDecision != null && requestedDecision != decision;
    }
}
