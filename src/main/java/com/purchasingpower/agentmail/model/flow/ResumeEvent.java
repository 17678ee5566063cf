package com.purchasingpower.agentmail.model.flow;

import com.purchasingpower.agentmail.model.mail.Email;
import lombok.Builder;
import lombok.Value;

/**
 * A reply that should wake a waiting flow.
 */
@Value
@Builder
public class ResumeEvent {

    WaitType type;

    Email email;

    /**
     * Request token found in the reply subject, if any.
     */
    String requestId;

    /**
     * Agent that sent the reply, for agent responses.
     */
    String senderAgentId;

    public static ResumeEvent emailResponse(Email email) {
        return ResumeEvent.builder().type(WaitType.EMAIL_RESPONSE).email(email).build();
    }

    public static ResumeEvent agentResponse(Email email, String requestId, String senderAgentId) {
        return ResumeEvent.builder()
                .type(WaitType.AGENT_RESPONSE)
                .email(email)
                .requestId(requestId)
                .senderAgentId(senderAgentId)
                .build();
    }
}
