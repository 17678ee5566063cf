package com.purchasingpower.agentmail.service.mail;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.agentmail.config.FlowProperties;
import com.purchasingpower.agentmail.model.mail.ThreadingHeaders;
import com.purchasingpower.agentmail.util.MessageIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Derives threading information from inbound webhook payloads.
 *
 * <p>Mail providers disagree on where threading headers live: as top-level fields with
 * varying case, inside a {@code headers} object, as a raw header block, or as a list of
 * name/value pairs. Each header is looked up in a fixed order and the first non-empty
 * value wins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ThreadCorrelator {

    static final String IN_REPLY_TO = "in-reply-to";
    static final String REFERENCES = "references";

    private static final List<String> IN_REPLY_TO_KEYS = List.of("In-Reply-To", "in-reply-to", "IN-REPLY-TO", "inReplyTo", "in_reply_to");
    private static final List<String> REFERENCES_KEYS = List.of("References", "references", "REFERENCES");

    private final FlowProperties flowProperties;
    private final ObjectMapper objectMapper;

    /**
     * Extracts normalized In-Reply-To and References ids from a provider payload.
     * Missing or malformed headers yield empty lists; this method does not throw.
     */
    public ThreadingHeaders extractThreadingHeaders(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return ThreadingHeaders.empty();
        }
        try {
            int limit = flowProperties.getReferenceLookback();
            String inReplyTo = findHeader(payload, IN_REPLY_TO_KEYS, IN_REPLY_TO);
            String references = findHeader(payload, REFERENCES_KEYS, REFERENCES);
            return new ThreadingHeaders(MessageIds.parseList(inReplyTo, limit), MessageIds.parseList(references, limit));
        } catch (RuntimeException e) {
            log.warn("Could not read threading headers from payload, treating message as a new thread: {}", e.getMessage());
            return ThreadingHeaders.empty();
        }
    }

    /**
     * Thread identifier: the first References entry (the thread root), else the first
     * In-Reply-To entry, else the message's own id. Always normalized.
     */
    public String buildConversationId(String messageId, List<String> inReplyTo, List<String> references) {
        int limit = flowProperties.getReferenceLookback();
        List<String> refs = references == null ? List.of() : MessageIds.normalizeAll(references, limit);
        if (!refs.isEmpty()) {
            return refs.get(0);
        }
        List<String> parents = inReplyTo == null ? List.of() : MessageIds.normalizeAll(inReplyTo, limit);
        if (!parents.isEmpty()) {
            return parents.get(0);
        }
        return MessageIds.normalize(messageId);
    }

    private String findHeader(JsonNode payload, List<String> topLevelKeys, String canonicalName) {
        for (String key : topLevelKeys) {
            String value = text(payload.get(key));
            if (value != null) {
                return value;
            }
        }

        JsonNode headers = payload.get("headers");
        if (headers != null && headers.isObject()) {
            String value = fieldIgnoreCase(headers, canonicalName);
            if (value != null) {
                return value;
            }
        } else if (headers != null && headers.isTextual()) {
            String value = fromRawHeaderBlock(headers.asText(), canonicalName);
            if (value != null) {
                return value;
            }
        }

        JsonNode nested = payload.path("message").path("headers");
        if (nested.isObject()) {
            String value = fieldIgnoreCase(nested, canonicalName);
            if (value != null) {
                return value;
            }
        }

        return fromHeaderPairs(payload.get("message-headers"), canonicalName);
    }

    private String fieldIgnoreCase(JsonNode object, String name) {
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().equalsIgnoreCase(name)) {
                String value = text(field.getValue());
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    private String fromRawHeaderBlock(String block, String name) {
        String unfolded = block.replaceAll("\\r?\\n[ \\t]+", " ");
        for (String line : unfolded.split("\\r?\\n")) {
            int colon = line.indexOf(':');
            if (colon > 0 && line.substring(0, colon).trim().equalsIgnoreCase(name)) {
                String value = line.substring(colon + 1).trim();
                return value.isEmpty() ? null : value;
            }
        }
        return null;
    }

    /**
     * Header list in the {@code [["Name","value"], ...]} form, either as JSON or as a JSON string.
     */
    private String fromHeaderPairs(JsonNode pairs, String name) {
        if (pairs == null || pairs.isNull()) {
            return null;
        }
        JsonNode list = pairs;
        if (pairs.isTextual()) {
            try {
                list = objectMapper.readTree(pairs.asText());
            } catch (Exception e) {
                log.debug("message-headers is not valid JSON: {}", e.getMessage());
                return null;
            }
        }
        if (!list.isArray()) {
            return null;
        }
        for (JsonNode pair : list) {
            if (pair.isArray() && pair.size() >= 2 && name.equalsIgnoreCase(pair.get(0).asText())) {
                String value = text(pair.get(1));
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    private String text(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            List<String> parts = new ArrayList<>();
            node.forEach(item -> {
                if (item.isValueNode() && !item.asText().isBlank()) {
                    parts.add(item.asText());
                }
            });
            return parts.isEmpty() ? null : String.join(" ", parts);
        }
        if (!node.isValueNode()) {
            return null;
        }
        String value = node.asText();
        return value == null || value.isBlank() ? null : value;
    }
}
