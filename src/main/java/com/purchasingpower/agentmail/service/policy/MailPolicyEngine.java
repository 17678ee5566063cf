package com.purchasingpower.agentmail.service.policy;

import com.purchasingpower.agentmail.model.directory.AgentProfile;
import com.purchasingpower.agentmail.model.directory.DirectoryContext;
import com.purchasingpower.agentmail.model.directory.MailPolicyConfig;
import com.purchasingpower.agentmail.model.directory.MailPolicyRule;
import com.purchasingpower.agentmail.util.MailAddresses;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Decides whether an agent may receive mail from, or send mail to, an address.
 *
 * <p>Evaluation order for one direction:
 * <ol>
 *   <li>empty address: deny</li>
 *   <li>address on the direction's allowlist: allow</li>
 *   <li>address local part is a known agent username: allow</li>
 *   <li>rule {@code any}: allow</li>
 *   <li>rule {@code team_and_agents} or {@code team_only}: allow team members, deny others</li>
 *   <li>rule {@code agents_only}: deny</li>
 * </ol>
 * Stateless and side-effect free.
 */
@Component
public class MailPolicyEngine {

    public MailPolicy normalizeMailPolicy(AgentProfile agent) {
        return normalizeMailPolicy(agent == null ? null : agent.getMailPolicy());
    }

    /**
     * Fills defaults, maps unknown rules to {@code team_and_agents}, and lowercases,
     * trims and de-duplicates the allowlists. Idempotent.
     */
    public MailPolicy normalizeMailPolicy(MailPolicyConfig config) {
        if (config == null) {
            return new MailPolicy(MailPolicyRule.DEFAULT, MailPolicyRule.DEFAULT, Set.of(), Set.of());
        }
        return new MailPolicy(
                MailPolicyRule.fromValue(config.getInbound()),
                MailPolicyRule.fromValue(config.getOutbound()),
                toAddressSet(config.getAllowedInboundAddresses()),
                toAddressSet(config.getAllowedOutboundAddresses()));
    }

    public PolicyDecision evaluateInboundMail(AgentProfile agent, String from, DirectoryContext directory) {
        return evaluate(MailDirection.INBOUND, from, agent, directory);
    }

    public PolicyDecision evaluateOutboundMail(AgentProfile agent, String to, DirectoryContext directory) {
        return evaluate(MailDirection.OUTBOUND, to, agent, directory);
    }

    public PolicyDecision evaluate(MailDirection direction, String address, AgentProfile agent, DirectoryContext directory) {
        String email = MailAddresses.extractAddress(address);
        if (email == null) {
            return PolicyDecision.deny(direction, "empty_address");
        }

        MailPolicy policy = normalizeMailPolicy(agent);
        if (policy.allowlist(direction).contains(email)) {
            return PolicyDecision.allow("allowlisted");
        }

        String localPart = MailAddresses.localPart(email);
        if (directory.agentUsernames().contains(localPart)) {
            return PolicyDecision.allow("known_agent");
        }

        MailPolicyRule rule = policy.rule(direction);
        if (rule == MailPolicyRule.ANY) {
            return PolicyDecision.allow("rule_any");
        }

        if (rule.allowsTeamMembers()) {
            if (directory.teamMemberAddresses(agent.getTeamId()).contains(email)) {
                return PolicyDecision.allow("team_member");
            }
            return PolicyDecision.deny(direction,
                    rule == MailPolicyRule.TEAM_ONLY ? "not_team_member" : "not_agent_or_team_member");
        }

        return PolicyDecision.deny(direction, "not_agent");
    }

    /**
     * One-line description for operator logs.
     */
    public String summarize(MailPolicy policy) {
        return String.format("inbound=%s%s, outbound=%s%s",
                policy.inbound().getValue(), allowlistSuffix(policy.allowedInboundAddresses()),
                policy.outbound().getValue(), allowlistSuffix(policy.allowedOutboundAddresses()));
    }

    private String allowlistSuffix(Set<String> allowlist) {
        return allowlist.isEmpty() ? "" : " (+" + allowlist.size() + " allowlisted)";
    }

    private Set<String> toAddressSet(Collection<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return Set.of();
        }
        Set<String> addresses = new LinkedHashSet<>();
        for (String value : raw) {
            if (value != null && !value.isBlank()) {
                addresses.add(MailAddresses.normalize(value));
            }
        }
        return Collections.unmodifiableSet(addresses);
    }
}
