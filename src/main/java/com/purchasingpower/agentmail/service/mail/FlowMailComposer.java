package com.purchasingpower.agentmail.service.mail;

import com.purchasingpower.agentmail.agent.ModelDecision;
import com.purchasingpower.agentmail.model.flow.ConversationFlow;
import com.purchasingpower.agentmail.model.flow.WaitType;
import com.purchasingpower.agentmail.model.mail.Email;
import com.purchasingpower.agentmail.model.mail.OutboundEmail;
import com.purchasingpower.agentmail.service.routing.RequestIdToken;
import com.purchasingpower.agentmail.util.MailAddresses;
import com.purchasingpower.agentmail.util.MessageIds;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the emails a flow sends: replies to the requester, delegation requests to other agents,
 * and failure or timeout notices. Every message gets its id here so the engine can record it
 * before the message leaves.
 */
@Component
public class FlowMailComposer {

    static final String FAILURE_TEXT = "I apologize, but I was unable to complete your request.";
    static final String USER_TIMEOUT_TEXT = "I did not receive a reply to my last message, so I have closed this request.\n"
            + "Please send a new email if you still need help.";
    static final String AGENT_TIMEOUT_TEXT = "I was waiting for another agent to answer and did not hear back in time, "
            + "so I have closed this request.\nPlease send a new email if you still need help.";

    private static final DateTimeFormatter QUOTE_DATE = DateTimeFormatter.RFC_1123_DATE_TIME.withZone(ZoneOffset.UTC);
    private static final int MAX_REFERENCES = 20;

    /**
     * Final answer, quoting the original request.
     */
    public OutboundEmail finalReply(ConversationFlow flow, String from, String reply, Email answering) {
        String body = reply + "\n\n" + quote(flow.getTrigger());
        return reply(flow, from, answering, body);
    }

    /**
     * Follow-up question sent while the flow waits for the requester.
     */
    public OutboundEmail followUpQuestion(ConversationFlow flow, String from, String question, Email answering) {
        return reply(flow, from, answering, question);
    }

    public OutboundEmail failureNotice(ConversationFlow flow, String from, String explanation) {
        String body = FAILURE_TEXT;
        if (explanation != null && !explanation.isBlank()) {
            body += "\n\n" + explanation;
        }
        return reply(flow, from, flow.getTrigger(), body);
    }

    public OutboundEmail timeoutNotice(ConversationFlow flow, String from, WaitType waitedFor) {
        return reply(flow, from, flow.getTrigger(), waitedFor == WaitType.AGENT_RESPONSE ? AGENT_TIMEOUT_TEXT : USER_TIMEOUT_TEXT);
    }

    /**
     * Request to another agent. Starts a new thread whose subject carries the request token.
     */
    public OutboundEmail delegationRequest(ConversationFlow flow, String from, String to,
                                           String requestId, ModelDecision.DelegationRequest request) {
        String subject = request.getSubject() == null || request.getSubject().isBlank()
                ? flow.getTrigger().getSubject()
                : request.getSubject();
        StringBuilder body = new StringBuilder();
        body.append(request.getQuestion() == null ? "" : request.getQuestion().trim());
        body.append("\n\n---------- Forwarded message ----------\n");
        body.append("From: ").append(flow.getTrigger().getFrom()).append('\n');
        body.append("Subject: ").append(flow.getTrigger().getSubject()).append("\n\n");
        body.append(flow.getTrigger().getBody() == null ? "" : flow.getTrigger().getBody());
        return OutboundEmail.builder()
                .messageId(MessageIds.generate(MailAddresses.domain(from)))
                .from(from)
                .to(to)
                .subject(RequestIdToken.tagSubject(requestId, subject))
                .body(body.toString())
                .build();
    }

    private OutboundEmail reply(ConversationFlow flow, String from, Email answering, String body) {
        Email target = answering == null ? flow.getTrigger() : answering;
        return OutboundEmail.builder()
                .messageId(MessageIds.generate(MailAddresses.domain(from)))
                .from(from)
                .to(flow.getTrigger().senderAddress())
                .subject(MailAddresses.replySubject(flow.getTrigger().getSubject()))
                .body(body)
                .inReplyTo(target.getMessageId())
                .references(references(flow, target))
                .build();
    }

    private List<String> references(ConversationFlow flow, Email target) {
        List<String> references = new ArrayList<>(target.getReferences());
        if (references.isEmpty() && flow.getConversationId() != null) {
            references.add(flow.getConversationId());
        }
        if (target.getMessageId() != null && !references.contains(target.getMessageId())) {
            references.add(target.getMessageId());
        }
        int from = Math.max(0, references.size() - MAX_REFERENCES);
        return new ArrayList<>(references.subList(from, references.size()));
    }

    private String quote(Email original) {
        StringBuilder quoted = new StringBuilder("---- Original Message ----\n");
        if (original.getReceivedAt() != null) {
            quoted.append("Date: ").append(QUOTE_DATE.format(original.getReceivedAt())).append('\n');
        }
        quoted.append("From: ").append(original.getFrom()).append('\n');
        quoted.append("To: ").append(original.getTo()).append('\n');
        quoted.append("Subject: ").append(original.getSubject()).append("\n\n");
        String body = original.getBody() == null ? "" : original.getBody();
        for (String line : body.split("\\r?\\n", -1)) {
            quoted.append("> ").append(line).append('\n');
        }
        return quoted.toString();
    }
}
