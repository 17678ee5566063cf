package com.purchasingpower.agentmail.agent.impl;

import com.purchasingpower.agentmail.agent.Tool;
import com.purchasingpower.agentmail.agent.ToolContext;
import com.purchasingpower.agentmail.agent.ToolExecutionGateway;
import com.purchasingpower.agentmail.agent.ToolResult;
import com.purchasingpower.agentmail.exception.ToolExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Gateway over the {@link Tool} beans in the application context.
 */
@Slf4j
@Component
public class RegisteredToolGateway implements ToolExecutionGateway {

    private final Map<String, Tool> tools;

    public RegisteredToolGateway(List<Tool> tools) {
        this.tools = tools.stream().collect(Collectors.toMap(Tool::getName, Function.identity()));
        log.info("🔧 Registered {} tools: {}", this.tools.size(), this.tools.keySet());
    }

    @Override
    public ToolResult execute(String toolName, Map<String, Object> arguments, ToolContext context) {
        Tool tool = tools.get(toolName);
        if (tool == null || !context.getAllowedTools().contains(toolName)) {
            log.warn("Agent {} asked for unavailable tool '{}'", context.getAgentId(), toolName);
            return ToolResult.failure("Tool not available: " + toolName);
        }

        log.info("🔧 Executing tool {} for flow {}", toolName, context.getFlowId());
        long start = System.currentTimeMillis();
        try {
            ToolResult result = tool.execute(arguments == null ? Map.of() : arguments, context);
            log.info("🔧 Tool {} finished in {}ms, success={}", toolName, System.currentTimeMillis() - start, result.isSuccess());
            return result;
        } catch (RuntimeException e) {
            log.error("🔴 Tool {} failed for flow {}: {}", toolName, context.getFlowId(), e.getMessage());
            throw new ToolExecutionException(toolName, "Tool " + toolName + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Tool> availableTools(ToolContext context) {
        return context.getAllowedTools().stream()
                .map(tools::get)
                .filter(tool -> tool != null)
                .collect(Collectors.toList());
    }
}
