package com.purchasingpower.agentmail.service.impl;

import com.purchasingpower.agentmail.config.DirectoryProperties;
import com.purchasingpower.agentmail.model.directory.AgentProfile;
import com.purchasingpower.agentmail.model.directory.DirectoryContext;
import com.purchasingpower.agentmail.model.directory.Team;
import com.purchasingpower.agentmail.model.directory.TeamMember;
import com.purchasingpower.agentmail.service.AgentDirectory;
import com.purchasingpower.agentmail.service.policy.MailPolicyEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Directory built once from {@code app.directory} configuration.
 */
@Slf4j
@Service
public class ConfiguredAgentDirectory implements AgentDirectory {

    private final DirectoryContext context;

    public ConfiguredAgentDirectory(DirectoryProperties properties, MailPolicyEngine mailPolicyEngine) {
        List<Team> teams = properties.getTeams().stream()
                .map(t -> new Team(t.getId(), t.getName(), t.getDomain(), t.getMembers().stream()
                        .map(m -> new TeamMember(m.getId(), m.getName(), m.getEmail()))
                        .collect(Collectors.toList())))
                .collect(Collectors.toList());

        List<AgentProfile> agents = properties.getAgents().stream()
                .map(a -> AgentProfile.builder()
                        .id(a.getId())
                        .username(a.getUsername())
                        .name(a.getName())
                        .teamId(a.getTeamId())
                        .prompt(a.getPrompt())
                        .tools(List.copyOf(a.getTools()))
                        .mailPolicy(mailPolicyEngine.normalizeMailPolicy(a.getMailPolicy()).toConfig())
                        .multiRound(a.getMultiRound())
                        .build())
                .collect(Collectors.toList());

        this.context = new DirectoryContext(agents, teams);

        for (AgentProfile agent : agents) {
            if (context.findTeam(agent.getTeamId()).isEmpty()) {
                log.warn("⚠️ Agent {} references unknown team {}", agent.getId(), agent.getTeamId());
            }
            log.info("📇 Agent {} <{}> mail policy: {}", agent.getId(), context.agentAddress(agent),
                    mailPolicyEngine.summarize(mailPolicyEngine.normalizeMailPolicy(agent)));
        }
        log.info("📇 Directory loaded: {} teams, {} agents", teams.size(), agents.size());
    }

    @Override
    public DirectoryContext snapshot() {
        return context;
    }
}
