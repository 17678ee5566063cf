package com.purchasingpower.agentmail.service.routing;

import com.purchasingpower.agentmail.model.directory.AgentProfile;
import com.purchasingpower.agentmail.model.directory.DirectoryContext;
import com.purchasingpower.agentmail.model.flow.AgentResponseWait;
import com.purchasingpower.agentmail.model.flow.ConversationFlow;
import com.purchasingpower.agentmail.model.flow.EmailResponseWait;
import com.purchasingpower.agentmail.model.flow.FlowState;
import com.purchasingpower.agentmail.model.flow.ResumeEvent;
import com.purchasingpower.agentmail.model.flow.WaitCondition;
import com.purchasingpower.agentmail.model.mail.Email;
import com.purchasingpower.agentmail.service.AgentDirectory;
import com.purchasingpower.agentmail.service.ConversationFlowStore;
import com.purchasingpower.agentmail.util.MailAddresses;
import com.purchasingpower.agentmail.util.MessageIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether an inbound message answers one of the recipient agent's waiting flows.
 *
 * <p>Matching per wait kind:
 * <ul>
 *   <li>user reply: same conversation id, or In-Reply-To/References naming a message of the flow's thread</li>
 *   <li>agent reply: the request token in the subject, or a header naming the delegation message,
 *       and the sender must be the agent the request was sent to</li>
 * </ul>
 * Waits whose deadline has passed never match. When several flows match, the most recently
 * created one wins and the ambiguity is logged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MessageRouter {

    private final ConversationFlowStore flowStore;
    private final AgentDirectory agentDirectory;
    private final Clock clock;

    public RoutingResult routeInboundEmail(Email email, String agentId) {
        return routeInboundEmail(email, agentId, agentDirectory.snapshot());
    }

    public RoutingResult routeInboundEmail(Email email, String agentId, DirectoryContext directory) {
        Instant now = clock.instant();
        List<ConversationFlow> waiting = flowStore.listByAgent(agentId, Set.of(FlowState.WAITING)).stream()
                .filter(flow -> !flow.isTimeoutDue(now))
                .sorted(Comparator.comparing(ConversationFlow::getCreatedAt).reversed())
                .collect(Collectors.toList());
        if (waiting.isEmpty()) {
            return RoutingResult.newRequest();
        }

        Set<String> referencedIds = referencedIds(email);
        String requestId = extractRequestId(email.getSubject());
        String senderAgentId = directory.findAgentByAddress(email.getFrom()).map(AgentProfile::getId).orElse(null);

        List<ConversationFlow> matches = waiting.stream()
                .filter(flow -> matches(flow, email, referencedIds, requestId))
                .collect(Collectors.toList());
        if (matches.isEmpty()) {
            return RoutingResult.newRequest();
        }
        if (matches.size() > 1) {
            log.warn("⚠️ Message {} matches {} waiting flows of agent {}: {}. Using {}",
                    email.getMessageId(), matches.size(), agentId,
                    matches.stream().map(ConversationFlow::getId).collect(Collectors.toList()),
                    matches.get(0).getId());
        }

        ConversationFlow flow = matches.get(0);
        ResumeEvent event = flow.getWaitingFor() instanceof AgentResponseWait
                ? ResumeEvent.agentResponse(email, requestId, senderAgentId)
                : ResumeEvent.emailResponse(email);
        log.info("🔀 Message {} routed to waiting flow {}", email.getMessageId(), flow.getId());
        return RoutingResult.resume(flow, event);
    }

    /**
     * Request id from a subject's {@code [REQ-...]} token, or {@code null}.
     */
    public String extractRequestId(String subject) {
        return RequestIdToken.extract(subject);
    }

    private boolean matches(ConversationFlow flow, Email email, Set<String> referencedIds, String requestId) {
        WaitCondition wait = flow.getWaitingFor();
        if (wait instanceof EmailResponseWait) {
            if (email.getConversationId() != null && email.getConversationId().equals(flow.getConversationId())) {
                return true;
            }
            return flow.getThreadMessageIds().stream().anyMatch(referencedIds::contains);
        }
        if (wait instanceof AgentResponseWait) {
            AgentResponseWait agentWait = (AgentResponseWait) wait;
            boolean correlated = (requestId != null && requestId.equalsIgnoreCase(agentWait.requestId()))
                    || referencedIds.contains(MessageIds.normalize(agentWait.delegationMessageId()));
            return correlated && isFromTarget(email, agentWait);
        }
        return false;
    }

    private boolean isFromTarget(Email email, AgentResponseWait wait) {
        String senderLocal = MailAddresses.localPart(email.getFrom());
        String targetLocal = MailAddresses.localPart(wait.targetAddress());
        if (senderLocal == null || !Objects.equals(senderLocal, targetLocal)) {
            log.debug("Reply from {} carries request {} but that request went to {}",
                    email.getFrom(), wait.requestId(), wait.targetAddress());
            return false;
        }
        return true;
    }

    private Set<String> referencedIds(Email email) {
        Set<String> ids = new LinkedHashSet<>();
        ids.addAll(email.getInReplyTo());
        ids.addAll(email.getReferences());
        ids.remove("");
        return ids;
    }
}
