package com.purchasingpower.agentmail.model.flow;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Present on flows started by another agent's delegation.
 */
@Value
@Builder
@Jacksonized
public class DelegationInfo {

    /**
     * Request token carried in the delegation subject.
     */
    String requestId;

    String requesterAgentId;

    /**
     * Flow on the requesting side, when it could be resolved.
     */
    String parentFlowId;

    /**
     * Agent ids that delegated, oldest first. The last entry is {@link #requesterAgentId}.
     */
    @Builder.Default
    List<String> chain = List.of();

    public int depth() {
        return chain.size();
    }
}
