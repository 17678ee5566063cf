package com.purchasingpower.agentmail.model.flow;

import com.purchasingpower.agentmail.model.mail.Email;
import lombok.Builder;
import lombok.Value;

/**
 * Everything needed to create a flow for an inbound message that did not match a waiting flow.
 */
@Value
@Builder
public class FlowStartRequest {
    String agentId;
    String teamId;
    String userId;
    Email trigger;
    Requester requester;
    int maxRounds;
    int timeoutMinutes;
    DelegationInfo delegation;
}
