package com.purchasingpower.agentmail.agent;

/**
 * Result from a tool execution.
 */
public interface ToolResult {

    boolean isSuccess();

    /**
     * The primary result data, fed back to the model.
     */
    Object getData();

    /**
     * Short description of what happened, recorded in the round history.
     */
    String getSummary();

    String getError();

    static ToolResult success(Object data, String summary) {
        return new ToolResultImpl(true, data, summary, null);
    }

    static ToolResult failure(String error) {
        return new ToolResultImpl(false, null, null, error);
    }
}

/**
 * Default implementation of ToolResult.
 */
record ToolResultImpl(boolean isSuccess, Object data, String summary, String error) implements ToolResult {

    @Override
    public boolean isSuccess() {
        return isSuccess;
    }

    @Override
    public Object getData() {
        return data;
    }

    @Override
    public String getSummary() {
        return summary;
    }

    @Override
    public String getError() {
        return error;
    }
}
