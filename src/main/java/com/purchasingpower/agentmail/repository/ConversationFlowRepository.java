package com.purchasingpower.agentmail.repository;

import com.purchasingpower.agentmail.model.flow.ConversationFlowEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Repository for persisted conversation flows.
 */
@Repository
public interface ConversationFlowRepository extends JpaRepository<ConversationFlowEntity, String> {

    /**
     * Flows of an agent in any of the given states, newest first.
     */
    List<ConversationFlowEntity> findByAgentIdAndStateInOrderByCreatedAtDesc(String agentId, Collection<String> states);

    /**
     * All flows of an agent, newest first.
     */
    List<ConversationFlowEntity> findByAgentIdOrderByCreatedAtDesc(String agentId);

    /**
     * Flows in a state whose deadline is at or before the cutoff.
     * Used by the timeout sweep with state "waiting".
     */
    List<ConversationFlowEntity> findByStateAndTimeoutAtLessThanEqual(String state, Instant cutoff);

    long countByState(String state);
}
