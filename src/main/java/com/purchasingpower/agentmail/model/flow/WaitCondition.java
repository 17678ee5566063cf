package com.purchasingpower.agentmail.model.flow;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * What a waiting flow is waiting for. Present exactly when the flow is {@link FlowState#WAITING}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = EmailResponseWait.class, name = "email_response"),
    @JsonSubTypes.Type(value = AgentResponseWait.class, name = "agent_response")
})
public interface WaitCondition {

    WaitType type();
}
