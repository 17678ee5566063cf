package com.purchasingpower.agentmail.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Webhook acknowledgement. {@code ok} is always true so the mail provider does not retry;
 * {@code status} tells operators what happened to the message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InboundResult {

    public enum Status {
        STARTED,
        RESUMED,
        BLOCKED,
        DROPPED,
        ERROR
    }

    @Builder.Default
    private boolean ok = true;

    private Status status;

    private String flowId;

    private String flowState;

    public static InboundResult of(Status status) {
        return InboundResult.builder().status(status).build();
    }

    public static InboundResult of(Status status, String flowId, String flowState) {
        return InboundResult.builder().status(status).flowId(flowId).flowState(flowState).build();
    }
}
