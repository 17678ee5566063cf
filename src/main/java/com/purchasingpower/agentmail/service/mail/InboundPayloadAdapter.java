package com.purchasingpower.agentmail.service.mail;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.agentmail.exception.MalformedInboundException;
import com.purchasingpower.agentmail.model.mail.Email;
import com.purchasingpower.agentmail.model.mail.ThreadingHeaders;
import com.purchasingpower.agentmail.util.MailAddresses;
import com.purchasingpower.agentmail.util.MessageIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Turns a provider webhook payload into an {@link Email}.
 *
 * <p>Field names differ per provider, so each field is read from an ordered list of
 * candidate keys. Provider quirks stay in this class; the rest of the system only sees
 * {@link Email}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InboundPayloadAdapter {

    private static final List<String> FROM_KEYS = List.of("from", "From", "sender", "Sender");
    private static final List<String> TO_KEYS = List.of("recipient", "Recipient", "OriginalRecipient", "to", "To");
    private static final List<String> SUBJECT_KEYS = List.of("subject", "Subject");
    private static final List<String> TEXT_KEYS = List.of("stripped-text", "text", "body-plain", "TextBody", "body", "plain");
    private static final List<String> HTML_KEYS = List.of("stripped-html", "html", "body-html", "HtmlBody");
    private static final List<String> MESSAGE_ID_KEYS = List.of("messageId", "message-id", "Message-Id", "Message-ID", "MessageID", "message_id");

    private final ThreadCorrelator threadCorrelator;
    private final Clock clock;

    /**
     * @throws MalformedInboundException when the sender or recipient cannot be determined
     */
    public Email toEmail(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new MalformedInboundException("Inbound payload is not a JSON object");
        }

        String from = first(payload, FROM_KEYS);
        String to = first(payload, TO_KEYS);
        if (MailAddresses.extractAddress(from) == null) {
            throw new MalformedInboundException("Inbound payload has no sender address");
        }
        if (MailAddresses.extractAddress(to) == null) {
            throw new MalformedInboundException("Inbound payload has no recipient address");
        }

        String messageId = MessageIds.normalize(firstMessageId(payload));
        if (messageId.isEmpty()) {
            messageId = MessageIds.generate("inbound.agentmail.local");
            log.debug("Inbound payload carried no Message-ID, assigned {}", messageId);
        }

        ThreadingHeaders headers = threadCorrelator.extractThreadingHeaders(payload);
        String conversationId = threadCorrelator.buildConversationId(
                messageId, headers.getInReplyTo(), headers.getReferences());

        return Email.builder()
                .messageId(messageId)
                .from(from.trim())
                .to(to.trim())
                .subject(orEmpty(first(payload, SUBJECT_KEYS)))
                .body(orEmpty(first(payload, TEXT_KEYS)))
                .html(first(payload, HTML_KEYS))
                .inReplyTo(headers.getInReplyTo())
                .references(headers.getReferences())
                .receivedAt(clock.instant())
                .conversationId(conversationId)
                .build();
    }

    private String firstMessageId(JsonNode payload) {
        String direct = first(payload, MESSAGE_ID_KEYS);
        if (direct != null) {
            return direct;
        }
        JsonNode headers = payload.get("headers");
        if (headers != null && headers.isObject()) {
            for (String key : MESSAGE_ID_KEYS) {
                JsonNode value = headers.get(key);
                if (value != null && value.isValueNode() && !value.asText().isBlank()) {
                    return value.asText();
                }
            }
        }
        return null;
    }

    private String first(JsonNode payload, List<String> keys) {
        for (String key : keys) {
            JsonNode node = payload.get(key);
            if (node == null || node.isNull()) {
                continue;
            }
            if (node.isArray() && node.size() > 0) {
                node = node.get(0);
            }
            if (node.isObject()) {
                JsonNode address = node.has("address") ? node.get("address") : node.get("email");
                if (address != null && !address.asText().isBlank()) {
                    return address.asText();
                }
                continue;
            }
            if (node.isValueNode() && !node.asText().isBlank()) {
                return node.asText();
            }
        }
        return null;
    }

    private String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
