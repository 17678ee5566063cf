package com.purchasingpower.agentmail.service.impl;

import com.purchasingpower.agentmail.agent.ModelDecision;
import com.purchasingpower.agentmail.agent.RoundAgent;
import com.purchasingpower.agentmail.agent.RoundOutcome;
import com.purchasingpower.agentmail.config.FlowProperties;
import com.purchasingpower.agentmail.exception.FlowNotFoundException;
import com.purchasingpower.agentmail.exception.FlowStateException;
import com.purchasingpower.agentmail.model.directory.AgentProfile;
import com.purchasingpower.agentmail.model.directory.DirectoryContext;
import com.purchasingpower.agentmail.model.flow.AgentResponseWait;
import com.purchasingpower.agentmail.model.flow.ConversationFlow;
import com.purchasingpower.agentmail.model.flow.EmailResponseWait;
import com.purchasingpower.agentmail.model.flow.FlowStartRequest;
import com.purchasingpower.agentmail.model.flow.FlowState;
import com.purchasingpower.agentmail.model.flow.ResumeEvent;
import com.purchasingpower.agentmail.model.flow.RoundDecision;
import com.purchasingpower.agentmail.model.flow.RoundInputKind;
import com.purchasingpower.agentmail.model.flow.RoundRecord;
import com.purchasingpower.agentmail.model.flow.RoundResult;
import com.purchasingpower.agentmail.model.flow.WaitCondition;
import com.purchasingpower.agentmail.model.flow.WaitType;
import com.purchasingpower.agentmail.model.mail.Email;
import com.purchasingpower.agentmail.model.mail.OutboundEmail;
import com.purchasingpower.agentmail.service.AgentDirectory;
import com.purchasingpower.agentmail.service.ConversationFlowStore;
import com.purchasingpower.agentmail.service.FlowEngine;
import com.purchasingpower.agentmail.service.mail.FlowMailComposer;
import com.purchasingpower.agentmail.service.mail.MailSender;
import com.purchasingpower.agentmail.service.policy.MailPolicyEngine;
import com.purchasingpower.agentmail.service.policy.PolicyDecision;
import com.purchasingpower.agentmail.service.routing.RequestIdToken;
import com.purchasingpower.agentmail.util.FlowLogContext;
import com.purchasingpower.agentmail.util.MailAddresses;
import com.purchasingpower.agentmail.util.MessageIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Default flow engine.
 *
 * <p>A round is executed in three steps: read the flow, run the agent without holding anything,
 * then commit the outcome with a compare-and-set write. Emails are sent only after the commit
 * succeeded. If the flow changed while the agent was thinking the commit fails and nothing is sent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlowEngineImpl implements FlowEngine {

    static final String BUDGET_EXHAUSTED = "round budget exhausted";
    static final String DELEGATION_BLOCKED = "delegation blocked";
    static final String DEFAULT_COMPLETION_TEXT = "Your request has been handled.";
    static final String BUDGET_EXHAUSTED_TEXT = "I have reached the limit of follow-up rounds for this request.";
    static final String DELEGATION_UNAVAILABLE_TEXT =
            "I was unable to obtain the additional information needed to fully answer your request.";

    private static final String ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final ConversationFlowStore flowStore;
    private final RoundAgent roundAgent;
    private final MailPolicyEngine mailPolicyEngine;
    private final AgentDirectory agentDirectory;
    private final MailSender mailSender;
    private final FlowMailComposer mailComposer;
    private final FlowProperties flowProperties;
    private final Clock clock;

    @Override
    public ConversationFlow startFlow(FlowStartRequest request) {
        if (request.getAgentId() == null || request.getAgentId().isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        if (request.getTrigger() == null) {
            throw new IllegalArgumentException("trigger email is required");
        }
        if (request.getMaxRounds() < 1) {
            throw new IllegalArgumentException("maxRounds must be at least 1, was " + request.getMaxRounds());
        }
        if (request.getTimeoutMinutes() < 1) {
            throw new IllegalArgumentException("timeoutMinutes must be at least 1, was " + request.getTimeoutMinutes());
        }

        String flowId = newFlowId(request.getAgentId());
        String conversationId = request.getTrigger().getConversationId() != null
                ? request.getTrigger().getConversationId()
                : MessageIds.normalize(request.getTrigger().getMessageId());

        try (FlowLogContext ignored = FlowLogContext.open(flowId, request.getAgentId())) {
            ConversationFlow flow = flowStore.create(ConversationFlow.start(flowId, request, conversationId, clock.instant()));
            log.info("🆕 Started flow {} for agent {} (maxRounds={}, timeout={}m, delegated={})",
                    flowId, request.getAgentId(), request.getMaxRounds(), request.getTimeoutMinutes(),
                    request.getDelegation() != null);
            return flow;
        }
    }

    @Override
    public RoundResult executeRound(String flowId, String agentId) {
        try (FlowLogContext ignored = FlowLogContext.open(flowId, agentId)) {
            while (true) {
                ConversationFlow flow = load(flowId);
                requireOwner(flow, agentId);
                if (flow.getState() != FlowState.ACTIVE) {
                    throw new FlowStateException(flowId, FlowStateException.Reason.NOT_ACTIVE,
                            "Cannot execute a round on a " + flow.getState().getValue() + " flow");
                }
                if (!flow.hasRoundsLeft()) {
                    throw new FlowStateException(flowId, FlowStateException.Reason.ROUND_LIMIT,
                            "Round budget of " + flow.getMaxRounds() + " exhausted");
                }

                DirectoryContext directory = agentDirectory.snapshot();
                AgentProfile agent = directory.findAgent(agentId).orElse(null);
                if (agent == null) {
                    log.error("🔴 Agent {} is no longer configured, failing flow {}", agentId, flowId);
                    return failAfterError(flowId, null, directory, "Agent " + agentId + " is not configured");
                }

                log.info("▶️ Executing round {}/{} of flow {}", flow.getRound() + 1, flow.getMaxRounds(), flowId);
                RoundOutcome outcome;
                try {
                    outcome = roundAgent.runRound(flow, agent, directory);
                } catch (RuntimeException e) {
                    log.error("🔴 Round {} of flow {} failed: {}", flow.getRound() + 1, flowId, e.getMessage(), e);
                    return failAfterError(flowId, agent, directory, "Round " + (flow.getRound() + 1) + " failed: " + e.getMessage());
                }

                RoundResult result = commitRound(flow, agent, directory, outcome);
                if (result != null) {
                    return result;
                }
            }
        }
    }

    @Override
    public RoundResult resumeFlow(String flowId, ResumeEvent event, String agentId) {
        try (FlowLogContext ignored = FlowLogContext.open(flowId, agentId)) {
            ConversationFlow flow = load(flowId);
            requireOwner(flow, agentId);
            if (flow.isTimeoutDue(clock.instant())) {
                expire(flowId);
                throw new FlowStateException(flowId, FlowStateException.Reason.TIMED_OUT, "Reply arrived after the wait deadline");
            }

            flowStore.update(flowId, current -> {
                requireOwner(current, agentId);
                Instant now = clock.instant();
                if (current.getState() == FlowState.TIMED_OUT || current.isTimeoutDue(now)) {
                    throw new FlowStateException(flowId, FlowStateException.Reason.TIMED_OUT, "Flow timed out");
                }
                if (!current.isWaiting()) {
                    throw new FlowStateException(flowId, FlowStateException.Reason.NOT_WAITING,
                            "Flow is " + current.getState().getValue() + ", not waiting");
                }
                verifyEventMatchesWait(current, event);
                RoundInputKind kind = event.getType() == WaitType.AGENT_RESPONSE
                        ? RoundInputKind.AGENT_REPLY
                        : RoundInputKind.USER_REPLY;
                current.resume(event.getEmail(), kind, now);
            });

            log.info("⏯️ Flow {} resumed by {} from {}", flowId, event.getType(), event.getEmail().getFrom());
            return executeRound(flowId, agentId);
        }
    }

    @Override
    public ConversationFlow getFlow(String flowId) {
        ConversationFlow flow = load(flowId);
        if (flow.isTimeoutDue(clock.instant())) {
            expire(flowId);
            return load(flowId);
        }
        return flow;
    }

    @Override
    public List<ConversationFlow> listFlows(String agentId, Set<FlowState> states) {
        Instant now = clock.instant();
        flowStore.listByAgent(agentId, Set.of(FlowState.WAITING)).stream()
                .filter(flow -> flow.isTimeoutDue(now))
                .forEach(flow -> expire(flow.getId()));
        return flowStore.listByAgent(agentId, states);
    }

    @Override
    public int sweepTimeouts() {
        int timedOut = 0;
        for (ConversationFlow flow : flowStore.listExpiredWaiting(clock.instant())) {
            try {
                if (expire(flow.getId())) {
                    timedOut++;
                }
            } catch (RuntimeException e) {
                log.error("🔴 Could not time out flow {}: {}", flow.getId(), e.getMessage(), e);
            }
        }
        if (timedOut > 0) {
            log.info("⏰ Timeout sweep closed {} flows", timedOut);
        }
        return timedOut;
    }

    @Override
    public ConversationFlow failFlow(String flowId, String reason) {
        try (FlowLogContext ignored = FlowLogContext.open(flowId, null)) {
            String note = reason == null || reason.isBlank() ? "Failed by operator" : "Failed by operator: " + reason;
            ConversationFlow failed = flowStore.update(flowId, flow -> flow.fail(note, clock.instant()));
            log.warn("⛔ Flow {} failed by operator: {}", flowId, reason);
            notifyFailure(failed, agentDirectory.snapshot(), null);
            return failed;
        }
    }

    @Override
    public ConversationFlow extendTimeout(String flowId, int minutes) {
        ConversationFlow extended = flowStore.update(flowId, flow -> flow.extendTimeout(minutes, clock.instant()));
        log.info("⏳ Flow {} deadline moved to {}", flowId, extended.getTimeoutAt());
        return extended;
    }

    /**
     * Writes the outcome of a round and sends the resulting email.
     *
     * @return the round result, or {@code null} when the agent asked to continue
     */
    private RoundResult commitRound(ConversationFlow flow, AgentProfile agent, DirectoryContext directory, RoundOutcome outcome) {
        ModelDecision decision = outcome.getDecision();
        RoundDecision requested = decision.getDecision();
        RoundDecision effective = requested;
        String note = null;

        if (flow.isLastRound() && !requested.isFinal()) {
            log.info("Round budget reached on flow {}, converting {} to COMPLETE", flow.getId(), requested);
            effective = RoundDecision.COMPLETE;
            note = BUDGET_EXHAUSTED;
        } else if (requested == RoundDecision.WAIT_FOR_USER && flow.getDelegation() != null) {
            log.info("Delegated flow {} cannot ask its requesting agent a question, replying instead", flow.getId());
            effective = RoundDecision.COMPLETE;
            note = "question returned to requesting agent";
        }

        DelegationPlan plan = null;
        if (effective == RoundDecision.WAIT_FOR_AGENT) {
            plan = planDelegation(flow, agent, directory, decision.getDelegation());
            if (plan.blockedReason() != null) {
                log.warn("⚠️ Delegation from flow {} blocked: {}", flow.getId(), plan.blockedReason());
                effective = RoundDecision.COMPLETE;
                note = DELEGATION_BLOCKED + " (" + plan.blockedReason() + ")";
            }
        }

        String from = senderAddress(agent, directory);
        Email answering = latestRequesterMessage(flow);
        Instant now = clock.instant();
        RoundRecord.RoundRecordBuilder record = RoundRecord.builder()
                .index(flow.getRound())
                .inputKind(flow.getNextInputKind())
                .input(flow.getRound() == 0 ? null : flow.getNextInput())
                .toolCalls(outcome.getToolCalls())
                .decision(effective)
                .requestedDecision(requested == effective ? null : requested)
                .reasoning(note == null ? decision.getReasoning() : joinNote(decision.getReasoning(), note))
                .timestamp(now);

        return switch (effective) {
            case CONTINUE -> {
                flow.appendRound(record.build(), now);
                flowStore.compareAndSet(flow);
                log.info("🔁 Flow {} continues to round {}", flow.getId(), flow.getRound() + 1);
                yield null;
            }
            case WAIT_FOR_USER -> {
                String question = orDefault(decision.getReply(), "Could you provide more details about your request?");
                PolicyDecision policy = mailPolicyEngine.evaluateOutboundMail(agent, flow.getTrigger().senderAddress(), directory);
                if (!policy.allowed()) {
                    yield completeWithoutReply(flow, record, requested, policy.reason(), now);
                }
                OutboundEmail mail = mailComposer.followUpQuestion(flow, from, question, answering);
                flow.appendRound(record.reply(question).build(), now);
                flow.addThreadMessageId(mail.getMessageId());
                flow.waitFor(new EmailResponseWait(MessageIds.normalize(mail.getMessageId())),
                        now.plus(Duration.ofMinutes(flow.getTimeoutMinutes())), now);
                ConversationFlow saved = flowStore.compareAndSet(flow);
                log.info("⏸️ Flow {} waiting for {} until {}", saved.getId(), mail.getTo(), saved.getTimeoutAt());
                yield sendOrFail(saved, mail, requested, directory, agent);
            }
            case WAIT_FOR_AGENT -> {
                OutboundEmail mail = mailComposer.delegationRequest(flow, from, plan.targetAddress(), plan.requestId(),
                        decision.getDelegation());
                flow.appendRound(record.reply(mail.getBody()).build(), now);
                flow.waitFor(new AgentResponseWait(plan.requestId(), plan.target().getId(), plan.targetAddress(),
                                MessageIds.normalize(mail.getMessageId())),
                        now.plus(Duration.ofMinutes(flowProperties.getDelegationTimeoutMinutes())), now);
                ConversationFlow saved = flowStore.compareAndSet(flow);
                log.info("⏸️ Flow {} delegated request {} to agent {} until {}",
                        saved.getId(), plan.requestId(), plan.target().getId(), saved.getTimeoutAt());
                yield sendOrFail(saved, mail, requested, directory, agent);
            }
            case COMPLETE -> {
                String reply = completionText(decision, requested, note);
                PolicyDecision policy = mailPolicyEngine.evaluateOutboundMail(agent, flow.getTrigger().senderAddress(), directory);
                if (!policy.allowed()) {
                    yield completeWithoutReply(flow, record, requested, policy.reason(), now);
                }
                OutboundEmail mail = mailComposer.finalReply(flow, from, reply, answering);
                flow.appendRound(record.reply(reply).build(), now);
                flow.addThreadMessageId(mail.getMessageId());
                flow.complete(note == null ? "completed" : "completed: " + note, now);
                ConversationFlow saved = flowStore.compareAndSet(flow);
                log.info("✅ Flow {} completed after {} rounds", saved.getId(), saved.getRound());
                if (!dispatch(mail)) {
                    log.error("🔴 Final reply of completed flow {} could not be sent", saved.getId());
                }
                yield RoundResult.of(saved, effective, requested != effective, decision.getReasoning());
            }
            case FAIL -> {
                String explanation = decision.getReply();
                flow.appendRound(record.reply(explanation).build(), now);
                flow.fail(orDefault(decision.getReasoning(), "agent decided to fail"), now);
                ConversationFlow saved = flowStore.compareAndSet(flow);
                log.warn("⛔ Flow {} failed by agent decision: {}", saved.getId(), decision.getReasoning());
                notifyFailure(saved, directory, explanation);
                yield RoundResult.of(saved, RoundDecision.FAIL, false, decision.getReasoning());
            }
        };
    }

    private RoundResult completeWithoutReply(ConversationFlow flow, RoundRecord.RoundRecordBuilder record,
                                             RoundDecision requested, String policyReason, Instant now) {
        log.warn("⚠️ Reply from flow {} to {} blocked by mail policy: {}",
                flow.getId(), flow.getTrigger().senderAddress(), policyReason);
        flow.appendRound(record.decision(RoundDecision.COMPLETE)
                .requestedDecision(requested == RoundDecision.COMPLETE ? null : requested)
                .build(), now);
        flow.complete("completed without reply: " + policyReason, now);
        ConversationFlow saved = flowStore.compareAndSet(flow);
        return RoundResult.of(saved, RoundDecision.COMPLETE, requested != RoundDecision.COMPLETE, policyReason);
    }

    private RoundResult sendOrFail(ConversationFlow saved, OutboundEmail mail, RoundDecision requested,
                                   DirectoryContext directory, AgentProfile agent) {
        RoundDecision effective = saved.getHistory().get(saved.getHistory().size() - 1).getDecision();
        if (dispatch(mail)) {
            return RoundResult.of(saved, effective, requested != effective, null);
        }
        return failAfterError(saved.getId(), agent, directory, "Could not send email to " + mail.getTo());
    }

    private DelegationPlan planDelegation(ConversationFlow flow, AgentProfile agent, DirectoryContext directory,
                                          ModelDecision.DelegationRequest request) {
        if (request == null || request.getAgentEmail() == null || request.getAgentEmail().isBlank()) {
            return DelegationPlan.blocked("missing_target");
        }
        if (!agent.getMultiRound().isCanCommunicateWithAgents()) {
            return DelegationPlan.blocked("agent_communication_disabled");
        }

        String targetRef = request.getAgentEmail();
        AgentProfile target = (targetRef.contains("@")
                ? directory.findAgentByAddress(targetRef)
                : directory.findAgentByUsername(targetRef)).orElse(null);
        if (target == null) {
            return DelegationPlan.blocked("unknown_target");
        }
        if (target.getId().equals(agent.getId())) {
            return DelegationPlan.blocked("self_delegation");
        }

        List<String> allowed = agent.getMultiRound().getAllowedAgentUsernames();
        if (allowed != null && !allowed.isEmpty()
                && allowed.stream().noneMatch(username -> username.equalsIgnoreCase(target.getUsername()))) {
            return DelegationPlan.blocked("target_not_allowed");
        }

        List<String> chain = new ArrayList<>();
        if (flow.getDelegation() != null) {
            chain.addAll(flow.getDelegation().getChain());
        }
        chain.add(agent.getId());
        if (chain.contains(target.getId())) {
            return DelegationPlan.blocked("delegation_cycle");
        }
        if (chain.size() > flowProperties.getMaxDelegationDepth()) {
            return DelegationPlan.blocked("delegation_depth_exceeded");
        }

        String targetAddress = directory.agentAddress(target);
        if (targetAddress == null) {
            return DelegationPlan.blocked("target_has_no_address");
        }
        PolicyDecision policy = mailPolicyEngine.evaluateOutboundMail(agent, targetAddress, directory);
        if (!policy.allowed()) {
            return DelegationPlan.blocked(policy.reason());
        }
        return new DelegationPlan(null, target, targetAddress, RequestIdToken.generate());
    }

    private void verifyEventMatchesWait(ConversationFlow flow, ResumeEvent event) {
        WaitCondition wait = flow.getWaitingFor();
        if (event.getEmail() == null || event.getType() != wait.type()) {
            throw new FlowStateException(flow.getId(), FlowStateException.Reason.WAIT_MISMATCH,
                    "Flow waits for " + wait.type() + " but got " + event.getType());
        }
        if (wait instanceof AgentResponseWait) {
            AgentResponseWait agentWait = (AgentResponseWait) wait;
            boolean tokenMatches = event.getRequestId() != null && event.getRequestId().equalsIgnoreCase(agentWait.requestId());
            boolean headerMatches = event.getEmail().getInReplyTo().contains(MessageIds.normalize(agentWait.delegationMessageId()))
                    || event.getEmail().getReferences().contains(MessageIds.normalize(agentWait.delegationMessageId()));
            if (!tokenMatches && !headerMatches) {
                throw new FlowStateException(flow.getId(), FlowStateException.Reason.WAIT_MISMATCH,
                        "Reply does not answer request " + agentWait.requestId());
            }
            boolean fromTarget = event.getSenderAgentId() != null
                    ? event.getSenderAgentId().equals(agentWait.targetAgentId())
                    : Objects.equals(MailAddresses.localPart(agentWait.targetAddress()), MailAddresses.localPart(event.getEmail().getFrom()));
            if (!fromTarget) {
                throw new FlowStateException(flow.getId(), FlowStateException.Reason.WAIT_MISMATCH,
                        "Request " + agentWait.requestId() + " was sent to " + agentWait.targetAgentId());
            }
        }
    }

    /**
     * Marks a due flow as timed out and sends the timeout notice.
     *
     * @return true if this call performed the transition
     */
    private boolean expire(String flowId) {
        AtomicReference<WaitType> expiredWait = new AtomicReference<>();
        ConversationFlow flow = flowStore.update(flowId, current -> {
            expiredWait.set(null);
            Instant now = clock.instant();
            if (current.isTimeoutDue(now)) {
                expiredWait.set(current.getWaitingFor().type());
                current.timeOut(now);
            }
        });
        if (expiredWait.get() == null) {
            return false;
        }
        try (FlowLogContext ignored = FlowLogContext.open(flowId, flow.getAgentId())) {
            log.info("⏰ Flow {} timed out waiting for {}", flowId, expiredWait.get());
            if (flowProperties.isSendTimeoutNotice()) {
                DirectoryContext directory = agentDirectory.snapshot();
                AgentProfile agent = directory.findAgent(flow.getAgentId()).orElse(null);
                dispatch(mailComposer.timeoutNotice(flow, senderAddress(agent, directory), expiredWait.get()));
            }
        }
        return true;
    }

    private RoundResult failAfterError(String flowId, AgentProfile agent, DirectoryContext directory, String reason) {
        AtomicBoolean transitioned = new AtomicBoolean();
        ConversationFlow failed = flowStore.update(flowId, flow -> {
            transitioned.set(false);
            if (!flow.isTerminal()) {
                flow.fail(reason, clock.instant());
                transitioned.set(true);
            }
        });
        if (transitioned.get()) {
            notifyFailure(failed, directory, null);
        } else {
            log.warn("⚠️ Flow {} was already {} when failing it ({}), no failure notice sent",
                    flowId, failed.getState().getValue(), reason);
        }
        return RoundResult.of(failed, RoundDecision.FAIL, false, reason);
    }

    private void notifyFailure(ConversationFlow flow, DirectoryContext directory, String explanation) {
        if (!flowProperties.isSendFailureNotice()) {
            return;
        }
        AgentProfile agent = directory.findAgent(flow.getAgentId()).orElse(null);
        String requester = flow.getTrigger().senderAddress();
        if (agent != null && !mailPolicyEngine.evaluateOutboundMail(agent, requester, directory).allowed()) {
            log.warn("⚠️ Failure notice for flow {} to {} blocked by mail policy", flow.getId(), requester);
            return;
        }
        dispatch(mailComposer.failureNotice(flow, senderAddress(agent, directory), explanation));
    }

    private boolean dispatch(OutboundEmail mail) {
        try {
            mailSender.send(mail);
            return true;
        } catch (RuntimeException e) {
            log.error("🔴 Failed to send email {} to {}: {}", mail.getMessageId(), mail.getTo(), e.getMessage(), e);
            return false;
        }
    }

    /**
     * Most recent message from the requester: the last user reply, or the trigger.
     */
    private Email latestRequesterMessage(ConversationFlow flow) {
        if (flow.getNextInputKind() == RoundInputKind.USER_REPLY) {
            return flow.getNextInput();
        }
        List<RoundRecord> history = flow.getHistory();
        for (int i = history.size() - 1; i >= 0; i--) {
            RoundRecord record = history.get(i);
            if (record.getInputKind() == RoundInputKind.USER_REPLY && record.getInput() != null) {
                return record.getInput();
            }
        }
        return flow.getTrigger();
    }

    private String completionText(ModelDecision decision, RoundDecision requested, String note) {
        String reply = decision.getReply();
        boolean hasReply = reply != null && !reply.isBlank();
        if (note == null) {
            return hasReply ? reply : DEFAULT_COMPLETION_TEXT;
        }
        if (note.startsWith(DELEGATION_BLOCKED)) {
            return hasReply ? reply + "\n\n" + DELEGATION_UNAVAILABLE_TEXT : DELEGATION_UNAVAILABLE_TEXT;
        }
        if (note.equals(BUDGET_EXHAUSTED) && requested != RoundDecision.COMPLETE) {
            return hasReply ? reply + "\n\n" + BUDGET_EXHAUSTED_TEXT : BUDGET_EXHAUSTED_TEXT;
        }
        return hasReply ? reply : DEFAULT_COMPLETION_TEXT;
    }

    private String senderAddress(AgentProfile agent, DirectoryContext directory) {
        String address = agent == null ? null : directory.agentAddress(agent);
        return address == null ? flowProperties.getSystemAddress() : address;
    }

    private ConversationFlow load(String flowId) {
        return flowStore.getById(flowId).orElseThrow(() -> new FlowNotFoundException(flowId));
    }

    private void requireOwner(ConversationFlow flow, String agentId) {
        if (!flow.getAgentId().equals(agentId)) {
            throw new FlowStateException(flow.getId(), FlowStateException.Reason.WRONG_AGENT,
                    "Flow belongs to agent " + flow.getAgentId() + ", not " + agentId);
        }
    }

    private String newFlowId(String agentId) {
        StringBuilder suffix = new StringBuilder(8);
        for (int i = 0; i < 8; i++) {
            suffix.append(ID_ALPHABET.charAt(RANDOM.nextInt(ID_ALPHABET.length())));
        }
        return "flow-" + agentId + "-" + suffix;
    }

    private static String joinNote(String reasoning, String note) {
        return reasoning == null || reasoning.isBlank() ? "[" + note + "]" : reasoning + " [" + note + "]";
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private record DelegationPlan(String blockedReason, AgentProfile target, String targetAddress, String requestId) {

        static DelegationPlan blocked(String reason) {
            return new DelegationPlan(reason, null, null, null);
        }
    }
}
