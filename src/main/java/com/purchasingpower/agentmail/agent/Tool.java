package com.purchasingpower.agentmail.agent;

import java.util.Map;

/**
 * Capability an agent may invoke during a round.
 *
 * <p>Tools are Spring beans. An agent can only call the tools named in its profile.
 */
public interface Tool {

    /**
     * Unique name used by the model to invoke the tool (e.g. "list_agents").
     */
    String getName();

    /**
     * Human-readable description for the model.
     */
    String getDescription();

    /**
     * JSON schema of the parameters, shown to the model.
     */
    String getParameterSchema();

    /**
     * Execute this tool with the given parameters.
     *
     * @param parameters Input parameters from the model
     * @param context Flow and agent the call is made for
     * @return Tool execution result
     */
    ToolResult execute(Map<String, Object> parameters, ToolContext context);
}
