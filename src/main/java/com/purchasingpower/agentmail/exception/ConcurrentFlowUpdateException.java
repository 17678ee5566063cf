package com.purchasingpower.agentmail.exception;

import lombok.Getter;

/**
 * A flow changed between read and write. The caller re-reads and retries, or gives up.
 */
@Getter
public class ConcurrentFlowUpdateException extends RuntimeException {

    private final String flowId;

    public ConcurrentFlowUpdateException(String flowId, Throwable cause) {
        super("Flow " + flowId + " was modified concurrently", cause);
        this.flowId = flowId;
    }
}
