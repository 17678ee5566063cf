package com.purchasingpower.agentmail.exception;

import lombok.Getter;

/**
 * The agent could not finish a round: a tool call, the model call or the model's output failed.
 * The round is not retried.
 */
@Getter
public class ToolExecutionException extends RuntimeException {

    private final String toolName;

    public ToolExecutionException(String toolName, String message, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
    }

    public ToolExecutionException(String message, Throwable cause) {
        this(null, message, cause);
    }
}
