package com.purchasingpower.agentmail.model.directory;

import com.purchasingpower.agentmail.util.MailAddresses;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of agents and teams that policy evaluation, routing and
 * the flow engine read from. Lookups by address are case-insensitive.
 */
public final class DirectoryContext {

    private final List<AgentProfile> agents;
    private final List<Team> teams;

    public DirectoryContext(List<AgentProfile> agents, List<Team> teams) {
        this.agents = List.copyOf(agents);
        this.teams = List.copyOf(teams);
    }

    public List<AgentProfile> getAgents() {
        return agents;
    }

    public List<Team> getTeams() {
        return teams;
    }

    public Optional<AgentProfile> findAgent(String agentId) {
        return agents.stream().filter(a -> a.getId().equals(agentId)).findFirst();
    }

    public Optional<AgentProfile> findAgentByUsername(String username) {
        String normalized = MailAddresses.normalize(username);
        return agents.stream()
                .filter(a -> MailAddresses.normalize(a.getUsername()).equals(normalized))
                .findFirst();
    }

    /**
     * Resolves the agent a sender address belongs to, by local part.
     */
    public Optional<AgentProfile> findAgentByAddress(String address) {
        String local = MailAddresses.localPart(address);
        return local == null ? Optional.empty() : findAgentByUsername(local);
    }

    /**
     * Resolves the agent a message was delivered to: the domain selects the team,
     * the local part selects the agent within it. Falls back to a directory-wide
     * username lookup when no team owns the domain.
     */
    public Optional<AgentProfile> findAgentByRecipient(String recipient) {
        String local = MailAddresses.localPart(recipient);
        String domain = MailAddresses.domain(recipient);
        if (local == null) {
            return Optional.empty();
        }
        Optional<Team> team = findTeamByDomain(domain);
        if (team.isPresent()) {
            String teamId = team.get().getId();
            return agents.stream()
                    .filter(a -> teamId.equals(a.getTeamId()))
                    .filter(a -> MailAddresses.normalize(a.getUsername()).equals(local))
                    .findFirst();
        }
        return findAgentByUsername(local);
    }

    public Optional<Team> findTeam(String teamId) {
        return teams.stream().filter(t -> t.getId().equals(teamId)).findFirst();
    }

    public Optional<Team> findTeamByDomain(String domain) {
        if (domain == null) {
            return Optional.empty();
        }
        String normalized = MailAddresses.normalize(domain);
        return teams.stream()
                .filter(t -> t.getDomain() != null && MailAddresses.normalize(t.getDomain()).equals(normalized))
                .findFirst();
    }

    public Optional<TeamMember> findTeamMember(String teamId, String address) {
        String normalized = MailAddresses.extractAddress(address);
        if (normalized == null) {
            return Optional.empty();
        }
        return findTeam(teamId).stream()
                .flatMap(t -> t.getMembers().stream())
                .filter(m -> normalized.equals(MailAddresses.extractAddress(m.getEmail())))
                .findFirst();
    }

    /**
     * Lowercased mail addresses of every member of the given team.
     */
    public Set<String> teamMemberAddresses(String teamId) {
        return findTeam(teamId)
                .map(t -> t.getMembers().stream()
                        .map(m -> MailAddresses.extractAddress(m.getEmail()))
                        .filter(a -> a != null)
                        .collect(Collectors.toCollection(LinkedHashSet::new)))
                .map(Collections::unmodifiableSet)
                .orElse(Set.of());
    }

    /**
     * Lowercased usernames of every configured agent.
     */
    public Set<String> agentUsernames() {
        return agents.stream()
                .map(a -> MailAddresses.normalize(a.getUsername()))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Mail address an agent sends from, or {@code null} if its team has no domain.
     */
    public String agentAddress(AgentProfile agent) {
        return findTeam(agent.getTeamId())
                .map(Team::getDomain)
                .filter(d -> !d.isBlank())
                .map(d -> MailAddresses.normalize(agent.getUsername()) + "@" + MailAddresses.normalize(d))
                .orElse(null);
    }
}
