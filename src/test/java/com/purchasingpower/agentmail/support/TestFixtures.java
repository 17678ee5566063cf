package com.purchasingpower.agentmail.support;

import com.purchasingpower.agentmail.model.directory.AgentProfile;
import com.purchasingpower.agentmail.model.directory.DirectoryContext;
import com.purchasingpower.agentmail.model.directory.MailPolicyConfig;
import com.purchasingpower.agentmail.model.directory.MultiRoundConfig;
import com.purchasingpower.agentmail.model.directory.Team;
import com.purchasingpower.agentmail.model.directory.TeamMember;
import com.purchasingpower.agentmail.model.flow.FlowStartRequest;
import com.purchasingpower.agentmail.model.flow.Requester;
import com.purchasingpower.agentmail.model.mail.Email;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Directory and messages shared by unit tests: team "acme" on domain agents.acme.test with
 * member alice@acme.test, agents "support" (may delegate) and "finance".
 */
public final class TestFixtures {

    public static final Instant START = Instant.parse("2026-03-02T09:00:00Z");
    public static final String ALICE = "alice@acme.test";
    public static final String SUPPORT_ADDRESS = "support@agents.acme.test";
    public static final String FINANCE_ADDRESS = "finance@agents.acme.test";

    private TestFixtures() {
    }

    public static AgentProfile support() {
        return AgentProfile.builder()
                .id("support")
                .username("support")
                .name("Support Agent")
                .teamId("acme")
                .prompt("You answer support questions.")
                .tools(List.of("list_agents"))
                .mailPolicy(MailPolicyConfig.builder().inbound("team_and_agents").outbound("team_and_agents").build())
                .multiRound(MultiRoundConfig.builder()
                        .maxRounds(5)
                        .timeoutMinutes(30)
                        .canCommunicateWithAgents(true)
                        .allowedAgentUsernames(new ArrayList<>())
                        .build())
                .build();
    }

    public static AgentProfile finance() {
        return AgentProfile.builder()
                .id("finance")
                .username("finance")
                .name("Finance Agent")
                .teamId("acme")
                .mailPolicy(MailPolicyConfig.builder().inbound("agents_only").outbound("team_and_agents").build())
                .multiRound(MultiRoundConfig.builder()
                        .maxRounds(3)
                        .timeoutMinutes(30)
                        .canCommunicateWithAgents(true)
                        .allowedAgentUsernames(new ArrayList<>())
                        .build())
                .build();
    }

    public static DirectoryContext directory(AgentProfile... agents) {
        Team acme = new Team("acme", "Acme Corp", "agents.acme.test",
                List.of(new TeamMember("user-alice", "Alice Jones", ALICE)));
        return new DirectoryContext(List.of(agents), List.of(acme));
    }

    public static DirectoryContext directory() {
        return directory(support(), finance());
    }

    public static Email email(String messageId, String from, String to, String subject, String body) {
        return Email.builder()
                .messageId(messageId)
                .from(from)
                .to(to)
                .subject(subject)
                .body(body)
                .receivedAt(START)
                .conversationId(messageId)
                .build();
    }

    /**
     * Reply to {@code parentId} in a thread rooted at {@code rootId}.
     */
    public static Email reply(String messageId, String from, String to, String subject, String body,
                              String rootId, String parentId) {
        return Email.builder()
                .messageId(messageId)
                .from(from)
                .to(to)
                .subject(subject)
                .body(body)
                .receivedAt(START)
                .inReplyTo(List.of(parentId))
                .references(rootId.equals(parentId) ? List.of(rootId) : List.of(rootId, parentId))
                .conversationId(rootId)
                .build();
    }

    public static FlowStartRequest startRequest(String agentId, Email trigger, int maxRounds) {
        return FlowStartRequest.builder()
                .agentId(agentId)
                .teamId("acme")
                .userId("user-alice")
                .trigger(trigger)
                .requester(Requester.builder().name("Alice Jones").address(ALICE).build())
                .maxRounds(maxRounds)
                .timeoutMinutes(30)
                .build();
    }
}
