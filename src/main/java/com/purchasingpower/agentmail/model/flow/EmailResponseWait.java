package com.purchasingpower.agentmail.model.flow;

/**
 * Waiting for the requester to answer the interim reply with the given message id.
 */
public record EmailResponseWait(String replyMessageId) implements WaitCondition {

    @Override
    public WaitType type() {
        return WaitType.EMAIL_RESPONSE;
    }
}
