package com.purchasingpower.agentmail.model.flow;

/**
 * Source of the message a round processed.
 */
public enum RoundInputKind {
    /**
     * The email that created the flow.
     */
    TRIGGER,
    USER_REPLY,
    AGENT_REPLY,
    /**
     * No new message; the agent asked to keep working.
     */
    CONTINUATION
}
