package com.purchasingpower.agentmail.util;

import org.slf4j.MDC;

/**
 * Puts {@code flowId} and {@code agentId} into the logging MDC for the
 * duration of a try-with-resources block and restores the previous values
 * on close, so nested scopes behave.
 */
public final class FlowLogContext implements AutoCloseable {

    public static final String FLOW_ID = "flowId";
    public static final String AGENT_ID = "agentId";

    private final String previousFlowId;
    private final String previousAgentId;

    private FlowLogContext(String flowId, String agentId) {
        this.previousFlowId = MDC.get(FLOW_ID);
        this.previousAgentId = MDC.get(AGENT_ID);
        put(FLOW_ID, flowId);
        put(AGENT_ID, agentId);
    }

    public static FlowLogContext open(String flowId, String agentId) {
        return new FlowLogContext(flowId, agentId);
    }

    @Override
    public void close() {
        put(FLOW_ID, previousFlowId);
        put(AGENT_ID, previousAgentId);
    }

    private static void put(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
