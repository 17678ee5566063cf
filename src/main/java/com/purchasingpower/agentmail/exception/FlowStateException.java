package com.purchasingpower.agentmail.exception;

import lombok.Getter;

/**
 * An operation was attempted on a flow whose state does not allow it.
 */
@Getter
public class FlowStateException extends RuntimeException {

    public enum Reason {
        NOT_ACTIVE,
        NOT_WAITING,
        TIMED_OUT,
        WAIT_MISMATCH,
        WRONG_AGENT,
        ROUND_LIMIT
    }

    private final String flowId;
    private final Reason reason;

    public FlowStateException(String flowId, Reason reason, String message) {
        super(message + " (flow " + flowId + ", " + reason + ")");
        this.flowId = flowId;
        this.reason = reason;
    }
}
