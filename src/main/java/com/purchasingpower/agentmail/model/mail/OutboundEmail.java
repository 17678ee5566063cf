package com.purchasingpower.agentmail.model.mail;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Message handed to the {@code MailSender}. The message id is assigned before sending
 * so that it can be recorded on the flow ahead of delivery.
 */
@Value
@Builder
public class OutboundEmail {

    String messageId;
    String from;
    String to;
    String subject;
    String body;
    String inReplyTo;

    @Builder.Default
    List<String> references = List.of();
}
