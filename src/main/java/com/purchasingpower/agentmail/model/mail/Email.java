package com.purchasingpower.agentmail.model.mail;

import com.purchasingpower.agentmail.util.MailAddresses;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * A normalized email message as seen by the flow engine.
 *
 * <p>Built once by the inbound adapter and never modified afterwards. The
 * {@code inReplyTo} and {@code references} lists hold message ids already
 * normalized (angle brackets stripped, lowercased).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Email {

    String messageId;

    /**
     * Raw From header, possibly with a display name.
     */
    String from;

    /**
     * Raw To header of the recipient this message was delivered to.
     */
    String to;

    String subject;

    String body;

    String html;

    @Builder.Default
    List<String> inReplyTo = List.of();

    @Builder.Default
    List<String> references = List.of();

    Instant receivedAt;

    /**
     * Thread identifier derived by the correlator.
     */
    String conversationId;

    public String senderAddress() {
        return MailAddresses.extractAddress(from);
    }

    public String recipientAddress() {
        return MailAddresses.extractAddress(to);
    }
}
