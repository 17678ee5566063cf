package com.purchasingpower.agentmail.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.agentmail.config.FlowProperties;
import com.purchasingpower.agentmail.exception.MalformedInboundException;
import com.purchasingpower.agentmail.model.directory.AgentProfile;
import com.purchasingpower.agentmail.model.directory.DirectoryContext;
import com.purchasingpower.agentmail.model.directory.MultiRoundConfig;
import com.purchasingpower.agentmail.model.directory.TeamMember;
import com.purchasingpower.agentmail.model.dto.InboundResult;
import com.purchasingpower.agentmail.model.flow.AgentResponseWait;
import com.purchasingpower.agentmail.model.flow.ConversationFlow;
import com.purchasingpower.agentmail.model.flow.DelegationInfo;
import com.purchasingpower.agentmail.model.flow.FlowStartRequest;
import com.purchasingpower.agentmail.model.flow.FlowState;
import com.purchasingpower.agentmail.model.flow.Requester;
import com.purchasingpower.agentmail.model.flow.RoundResult;
import com.purchasingpower.agentmail.model.mail.Email;
import com.purchasingpower.agentmail.service.AgentDirectory;
import com.purchasingpower.agentmail.service.FlowEngine;
import com.purchasingpower.agentmail.service.InboundMailService;
import com.purchasingpower.agentmail.service.mail.InboundPayloadAdapter;
import com.purchasingpower.agentmail.service.policy.MailPolicyEngine;
import com.purchasingpower.agentmail.service.policy.PolicyDecision;
import com.purchasingpower.agentmail.service.routing.MessageRouter;
import com.purchasingpower.agentmail.service.routing.RoutingResult;
import com.purchasingpower.agentmail.util.LogFormat;
import com.purchasingpower.agentmail.util.MailAddresses;
import com.purchasingpower.agentmail.util.MessageIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class InboundMailServiceImpl implements InboundMailService {

    private final InboundPayloadAdapter payloadAdapter;
    private final AgentDirectory agentDirectory;
    private final MailPolicyEngine mailPolicyEngine;
    private final MessageRouter messageRouter;
    private final FlowEngine flowEngine;
    private final FlowProperties flowProperties;

    @Override
    public InboundResult handleInbound(JsonNode payload) {
        Email email;
        try {
            email = payloadAdapter.toEmail(payload);
        } catch (MalformedInboundException e) {
            log.warn("📭 Dropping inbound payload: {}", e.getMessage());
            return InboundResult.of(InboundResult.Status.DROPPED);
        }

        log.info("📬 Inbound {} from {} to {}: {}", email.getMessageId(), email.getFrom(), email.getTo(),
                LogFormat.truncate(email.getSubject(), 120));

        try {
            DirectoryContext directory = agentDirectory.snapshot();
            Optional<AgentProfile> recipient = resolveRecipient(email, directory);
            if (recipient.isEmpty()) {
                log.warn("📭 No agent found for recipient {}, dropping {}", email.getTo(), email.getMessageId());
                return InboundResult.of(InboundResult.Status.DROPPED);
            }
            AgentProfile agent = recipient.get();

            PolicyDecision policy = mailPolicyEngine.evaluateInboundMail(agent, email.getFrom(), directory);
            if (!policy.allowed()) {
                log.warn("🚫 Inbound {} from {} to agent {} blocked: {}",
                        email.getMessageId(), email.senderAddress(), agent.getId(), policy.reason());
                return InboundResult.of(InboundResult.Status.BLOCKED);
            }

            RoutingResult route = messageRouter.routeInboundEmail(email, agent.getId(), directory);
            if (route.isFlowResponse()) {
                RoundResult result = flowEngine.resumeFlow(route.getFlow().getId(), route.getResumeEvent(), agent.getId());
                return InboundResult.of(InboundResult.Status.RESUMED, result.getFlowId(), result.getState().getValue());
            }

            ConversationFlow flow = flowEngine.startFlow(startRequest(email, agent, directory));
            RoundResult result = flowEngine.executeRound(flow.getId(), agent.getId());
            return InboundResult.of(InboundResult.Status.STARTED, result.getFlowId(), result.getState().getValue());

        } catch (RuntimeException e) {
            log.error("🔴 Failed to process inbound {}: {}", email.getMessageId(), e.getMessage(), e);
            return InboundResult.of(InboundResult.Status.ERROR);
        }
    }

    private Optional<AgentProfile> resolveRecipient(Email email, DirectoryContext directory) {
        for (String recipient : email.getTo().split("[,;]")) {
            Optional<AgentProfile> agent = directory.findAgentByRecipient(recipient);
            if (agent.isPresent()) {
                return agent;
            }
        }
        return Optional.empty();
    }

    private FlowStartRequest startRequest(Email email, AgentProfile agent, DirectoryContext directory) {
        MultiRoundConfig multiRound = agent.getMultiRound();
        FlowStartRequest.FlowStartRequestBuilder request = FlowStartRequest.builder()
                .agentId(agent.getId())
                .teamId(agent.getTeamId())
                .trigger(email)
                .maxRounds(multiRound.getMaxRounds() != null ? multiRound.getMaxRounds() : flowProperties.getDefaultMaxRounds())
                .timeoutMinutes(multiRound.getTimeoutMinutes() != null
                        ? multiRound.getTimeoutMinutes()
                        : flowProperties.getDefaultTimeoutMinutes());

        String sender = email.senderAddress();
        Optional<TeamMember> member = directory.findTeamMember(agent.getTeamId(), sender);
        if (member.isPresent()) {
            return request.userId(member.get().getId())
                    .requester(Requester.builder().name(member.get().getName()).address(sender).build())
                    .build();
        }

        Optional<AgentProfile> senderAgent = directory.findAgentByAddress(sender);
        if (senderAgent.isPresent()) {
            return delegatedRequest(request, email, senderAgent.get());
        }

        return request.requester(Requester.builder().name(MailAddresses.displayName(email.getFrom())).address(sender).build()).build();
    }

    /**
     * A request from another agent inherits the human requester of the flow that delegated it.
     */
    private FlowStartRequest delegatedRequest(FlowStartRequest.FlowStartRequestBuilder request, Email email,
                                              AgentProfile senderAgent) {
        String requestId = messageRouter.extractRequestId(email.getSubject());
        Optional<ConversationFlow> parent = flowEngine.listFlows(senderAgent.getId(), Set.of(FlowState.WAITING)).stream()
                .filter(flow -> flow.getWaitingFor() instanceof AgentResponseWait)
                .filter(flow -> {
                    AgentResponseWait wait = (AgentResponseWait) flow.getWaitingFor();
                    return (requestId != null && requestId.equalsIgnoreCase(wait.requestId()))
                            || MessageIds.normalize(wait.delegationMessageId()).equals(email.getMessageId());
                })
                .findFirst();

        List<String> chain = new ArrayList<>();
        if (parent.isPresent()) {
            ConversationFlow parentFlow = parent.get();
            if (parentFlow.getDelegation() != null) {
                chain.addAll(parentFlow.getDelegation().getChain());
            }
            chain.add(senderAgent.getId());
            AgentResponseWait wait = (AgentResponseWait) parentFlow.getWaitingFor();
            log.info("🤝 Request from agent {} belongs to flow {}", senderAgent.getId(), parentFlow.getId());
            return request.userId(parentFlow.getUserId())
                    .requester(parentFlow.getRequester())
                    .delegation(DelegationInfo.builder()
                            .requestId(wait.requestId())
                            .requesterAgentId(senderAgent.getId())
                            .parentFlowId(parentFlow.getId())
                            .chain(chain)
                            .build())
                    .build();
        }

        log.info("🤝 Request from agent {} without a matching delegating flow", senderAgent.getId());
        chain.add(senderAgent.getId());
        return request.requester(Requester.builder().name(senderAgent.displayName()).address(email.senderAddress()).build())
                .delegation(DelegationInfo.builder()
                        .requestId(requestId)
                        .requesterAgentId(senderAgent.getId())
                        .chain(chain)
                        .build())
                .build();
    }
}
