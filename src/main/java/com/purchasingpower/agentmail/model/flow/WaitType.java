package com.purchasingpower.agentmail.model.flow;

public enum WaitType {
    EMAIL_RESPONSE,
    AGENT_RESPONSE
}
