package com.purchasingpower.agentmail.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.agentmail.model.dto.InboundResult;

/**
 * Entry point for inbound mail webhooks.
 */
public interface InboundMailService {

    /**
     * Processes one provider payload end to end: recipient lookup, inbound policy, routing,
     * and starting or resuming a flow. Never throws; failures are logged and reported in the result.
     */
    InboundResult handleInbound(JsonNode payload);
}
