package com.purchasingpower.agentmail.agent;

import com.purchasingpower.agentmail.model.flow.RoundDecision;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One parsed model response: either a tool call or the round's decision.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelDecision {

    /**
     * Set when the model asked for a tool instead of deciding.
     */
    private String toolName;

    private Map<String, Object> toolParameters;

    private RoundDecision decision;

    /**
     * Reason for this decision (for logging/debugging)
     */
    private String reasoning;

    /**
     * Text for the requester: the final answer, the follow-up question, or a failure explanation.
     */
    private String reply;

    private double confidence;

    /**
     * Who to ask and what, for WAIT_FOR_AGENT.
     */
    private DelegationRequest delegation;

    public boolean isToolCall() {
        return toolName != null;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DelegationRequest {
        /**
         * Target agent's address or username.
         */
        private String agentEmail;
        private String subject;
        private String question;
    }

    public static ModelDecision toolCall(String toolName, Map<String, Object> parameters) {
        return ModelDecision.builder()
                .toolName(toolName)
                .toolParameters(parameters)
                .build();
    }

    public static ModelDecision complete(String reply, String reasoning) {
        return ModelDecision.builder()
                .decision(RoundDecision.COMPLETE)
                .reply(reply)
                .reasoning(reasoning)
                .confidence(1.0)
                .build();
    }

    public static ModelDecision waitForUser(String question, String reasoning) {
        return ModelDecision.builder()
                .decision(RoundDecision.WAIT_FOR_USER)
                .reply(question)
                .reasoning(reasoning)
                .build();
    }

    public static ModelDecision waitForAgent(DelegationRequest delegation, String reasoning) {
        return ModelDecision.builder()
                .decision(RoundDecision.WAIT_FOR_AGENT)
                .delegation(delegation)
                .reasoning(reasoning)
                .build();
    }

    public static ModelDecision proceed(String reasoning) {
        return ModelDecision.builder()
                .decision(RoundDecision.CONTINUE)
                .reasoning(reasoning)
                .build();
    }

    public static ModelDecision fail(String reply, String reasoning) {
        return ModelDecision.builder()
                .decision(RoundDecision.FAIL)
                .reply(reply)
                .reasoning(reasoning)
                .build();
    }
}
