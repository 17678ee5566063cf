package com.purchasingpower.agentmail.exception;

import lombok.Getter;

@Getter
public class FlowNotFoundException extends RuntimeException {

    private final String flowId;

    public FlowNotFoundException(String flowId) {
        super("Flow not found: " + flowId);
        this.flowId = flowId;
    }
}
