package com.purchasingpower.agentmail.service;

import com.purchasingpower.agentmail.exception.ConcurrentFlowUpdateException;
import com.purchasingpower.agentmail.exception.FlowNotFoundException;
import com.purchasingpower.agentmail.model.flow.ConversationFlow;
import com.purchasingpower.agentmail.model.flow.FlowState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Durable storage for conversation flows.
 *
 * <p>Every write is a compare-and-set on the flow's version: a write based on a stale
 * read fails with {@link ConcurrentFlowUpdateException} instead of silently overwriting.
 */
public interface ConversationFlowStore {

    /**
     * Persists a new flow and returns it with its initial version.
     */
    ConversationFlow create(ConversationFlow flow);

    Optional<ConversationFlow> getById(String flowId);

    /**
     * @param states states to include; empty means all
     */
    List<ConversationFlow> listByAgent(String agentId, Set<FlowState> states);

    /**
     * Waiting flows whose deadline is at or before {@code now}.
     */
    List<ConversationFlow> listExpiredWaiting(Instant now);

    /**
     * Writes the flow if the stored version still equals {@code flow.getVersion()}.
     *
     * @return the stored flow with its new version
     * @throws ConcurrentFlowUpdateException if the flow changed since it was read
     * @throws FlowNotFoundException if the flow does not exist
     */
    ConversationFlow compareAndSet(ConversationFlow flow);

    /**
     * Read-modify-write: loads the flow, applies the mutator and writes it back, re-reading and
     * re-applying on version conflicts up to the configured number of attempts. Exceptions
     * thrown by the mutator propagate unchanged and nothing is written.
     */
    ConversationFlow update(String flowId, Consumer<ConversationFlow> mutator);
}
