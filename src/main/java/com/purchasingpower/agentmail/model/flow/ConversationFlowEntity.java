package com.purchasingpower.agentmail.model.flow;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for persisting conversation flows.
 *
 * <p>Stores the entire ConversationFlow as JSON in a CLOB field. The columns next to it
 * are copies used for lookups (waiting flows per agent, expired waits).
 *
 * <p>Table: CONVERSATION_FLOWS
 */
@Entity
@Table(name = "CONVERSATION_FLOWS", indexes = {
        @Index(name = "idx_flow_agent_state", columnList = "agent_id, state"),
        @Index(name = "idx_flow_state_timeout", columnList = "state, timeout_at"),
        @Index(name = "idx_flow_conversation", columnList = "conversation_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationFlowEntity {

    /**
     * Flow id, e.g. "flow-support-a1b2c3d4".
     */
    @Id
    @Column(name = "id", length = 120)
    private String id;

    @Column(name = "agent_id", nullable = false, length = 100)
    private String agentId;

    @Column(name = "user_id", length = 100)
    private String userId;

    /**
     * Values: active, waiting, completed, timed_out, failed
     */
    @Column(name = "state", nullable = false, length = 20)
    private String state;

    @Column(name = "conversation_id", length = 500)
    private String conversationId;

    @Column(name = "round_no", nullable = false)
    private int round;

    /**
     * Set only while the flow is waiting.
     */
    @Column(name = "timeout_at")
    private Instant timeoutAt;

    /**
     * Complete flow as JSON.
     */
    @Lob
    @Column(name = "flow_json", nullable = false)
    private String flowJson;

    /**
     * Optimistic lock. Every successful write increments it.
     */
    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
