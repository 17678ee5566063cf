package com.purchasingpower.agentmail.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.purchasingpower.agentmail.model.dto.InboundResult;
import com.purchasingpower.agentmail.service.InboundMailService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Inbound mail webhook. Always answers 200 so providers do not redeliver;
 * the body tells what happened to the message.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/webhooks/mail")
@RequiredArgsConstructor
public class MailWebhookController {

    private final InboundMailService inboundMailService;
    private final ObjectMapper objectMapper;

    @PostMapping(path = "/inbound", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<InboundResult> handleJson(@RequestBody String rawPayload) {
        log.info("Received inbound mail webhook (JSON)");
        JsonNode payload;
        try {
            payload = objectMapper.readTree(rawPayload);
        } catch (JsonProcessingException e) {
            log.warn("Inbound webhook body is not valid JSON: {}", e.getOriginalMessage());
            return ResponseEntity.ok(InboundResult.of(InboundResult.Status.DROPPED));
        }
        return ResponseEntity.ok(inboundMailService.handleInbound(payload));
    }

    /**
     * Form-encoded variant used by providers that post fields instead of JSON.
     */
    @PostMapping(path = "/inbound", consumes = {
            MediaType.APPLICATION_FORM_URLENCODED_VALUE,
            MediaType.MULTIPART_FORM_DATA_VALUE
    })
    public ResponseEntity<InboundResult> handleForm(@RequestParam MultiValueMap<String, String> fields) {
        log.info("Received inbound mail webhook (form, {} fields)", fields.size());
        ObjectNode payload = objectMapper.createObjectNode();
        fields.forEach((name, values) -> {
            List<String> nonNull = values == null ? List.of() : values;
            if (!nonNull.isEmpty()) {
                payload.put(name, nonNull.get(0));
            }
        });
        return ResponseEntity.ok(inboundMailService.handleInbound(payload));
    }
}
