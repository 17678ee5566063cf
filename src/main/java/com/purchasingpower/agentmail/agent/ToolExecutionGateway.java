package com.purchasingpower.agentmail.agent;

import com.purchasingpower.agentmail.exception.ToolExecutionException;

import java.util.List;
import java.util.Map;

/**
 * Executes tool calls on behalf of an agent.
 */
public interface ToolExecutionGateway {

    /**
     * Runs a tool. A tool the agent may not use yields a failed result; a tool that
     * breaks while running raises an exception.
     *
     * @throws ToolExecutionException if the tool threw
     */
    ToolResult execute(String toolName, Map<String, Object> arguments, ToolContext context);

    /**
     * Tools the agent in {@code context} may call.
     */
    List<Tool> availableTools(ToolContext context);
}
