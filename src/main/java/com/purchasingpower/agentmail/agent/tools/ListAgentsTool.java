package com.purchasingpower.agentmail.agent.tools;

import com.purchasingpower.agentmail.agent.Tool;
import com.purchasingpower.agentmail.agent.ToolContext;
import com.purchasingpower.agentmail.agent.ToolResult;
import com.purchasingpower.agentmail.model.directory.AgentProfile;
import com.purchasingpower.agentmail.model.directory.DirectoryContext;
import com.purchasingpower.agentmail.service.AgentDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lists the other agents of the caller's team with their mail addresses, so the model can
 * pick a delegation target.
 */
@Component
@RequiredArgsConstructor
public class ListAgentsTool implements Tool {

    private final AgentDirectory agentDirectory;

    @Override
    public String getName() {
        return "list_agents";
    }

    @Override
    public String getDescription() {
        return "List the other agents on your team with their email address and role.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"type\":\"object\",\"properties\":{}}";
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        DirectoryContext directory = agentDirectory.snapshot();
        List<Map<String, String>> agents = directory.getAgents().stream()
                .filter(agent -> agent.getTeamId().equals(context.getTeamId()))
                .filter(agent -> !agent.getId().equals(context.getAgentId()))
                .map(agent -> describe(agent, directory))
                .collect(Collectors.toList());
        return ToolResult.success(agents, agents.size() + " agents on team " + context.getTeamId());
    }

    private Map<String, String> describe(AgentProfile agent, DirectoryContext directory) {
        Map<String, String> entry = new LinkedHashMap<>();
        entry.put("name", agent.displayName());
        entry.put("email", directory.agentAddress(agent));
        entry.put("username", agent.getUsername());
        return entry;
    }
}
