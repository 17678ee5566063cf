package com.purchasingpower.agentmail.model.flow;

/**
 * Waiting for another agent to answer a delegated request.
 *
 * @param requestId token embedded in the delegation subject
 * @param targetAgentId agent that must answer
 * @param targetAddress address the delegation was sent to
 * @param delegationMessageId message id of the delegation email, used when the token is stripped
 */
public record AgentResponseWait(
    String requestId,
    String targetAgentId,
    String targetAddress,
    String delegationMessageId
) implements WaitCondition {

    @Override
    public WaitType type() {
        return WaitType.AGENT_RESPONSE;
    }
}
