package com.purchasingpower.agentmail.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.agentmail.exception.ToolExecutionException;
import com.purchasingpower.agentmail.model.flow.RoundDecision;
import com.purchasingpower.agentmail.util.LogFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Parses the JSON the model returns each turn.
 *
 * <pre>
 * {"tool": "list_agents", "parameters": {}}
 * {"decision": "WAIT_FOR_AGENT", "reasoning": "...", "target_agent": {"agent_email": "...", "question": "..."}}
 * {"decision": "COMPLETE", "reasoning": "...", "reply": "..."}
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelDecisionParser {

    private static final TypeReference<Map<String, Object>> PARAMETERS = new TypeReference<>() { };

    private final ObjectMapper objectMapper;

    /**
     * @throws ToolExecutionException when the response holds neither a tool call nor a known decision
     */
    public ModelDecision parse(String llmResponse) {
        String json = extractJson(llmResponse);
        if (json == null) {
            throw new ToolExecutionException("Model response contained no JSON: " + LogFormat.truncate(llmResponse, 200), null);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException("Model response was not valid JSON", e);
        }

        String tool = text(root, "tool");
        if (tool != null) {
            Map<String, Object> parameters = root.has("parameters") && root.get("parameters").isObject()
                    ? objectMapper.convertValue(root.get("parameters"), PARAMETERS)
                    : Map.of();
            return ModelDecision.toolCall(tool, parameters);
        }

        RoundDecision decision = RoundDecision.parse(text(root, "decision"));
        if (decision == null) {
            throw new ToolExecutionException("Model returned unknown decision: " + text(root, "decision"), null);
        }

        String reply = text(root, "reply");
        if (reply == null) {
            reply = text(root, "final_response");
        }

        return ModelDecision.builder()
                .decision(decision)
                .reasoning(text(root, "reasoning"))
                .reply(reply)
                .confidence(root.path("confidence").asDouble(0.0))
                .delegation(parseDelegation(root.get("target_agent")))
                .build();
    }

    private ModelDecision.DelegationRequest parseDelegation(JsonNode target) {
        if (target == null || !target.isObject()) {
            return null;
        }
        String question = text(target, "question");
        if (question == null) {
            question = text(target, "message_body");
        }
        String subject = text(target, "subject");
        if (subject == null) {
            subject = text(target, "message_subject");
        }
        return ModelDecision.DelegationRequest.builder()
                .agentEmail(text(target, "agent_email"))
                .subject(subject)
                .question(question)
                .build();
    }

    private String extractJson(String text) {
        if (text == null) {
            return null;
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1);
        }
        return null;
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
