package com.purchasingpower.agentmail.service;

import com.purchasingpower.agentmail.exception.ConcurrentFlowUpdateException;
import com.purchasingpower.agentmail.exception.FlowNotFoundException;
import com.purchasingpower.agentmail.exception.FlowStateException;
import com.purchasingpower.agentmail.model.flow.ConversationFlow;
import com.purchasingpower.agentmail.model.flow.FlowStartRequest;
import com.purchasingpower.agentmail.model.flow.FlowState;
import com.purchasingpower.agentmail.model.flow.ResumeEvent;
import com.purchasingpower.agentmail.model.flow.RoundResult;

import java.util.List;
import java.util.Set;

/**
 * Drives conversation flows through their rounds.
 *
 * <p>All state changes are written through the flow store before any email leaves, so a crash
 * after a write never loses the fact that a message was about to be sent, and a failed write
 * never sends a message the stored flow does not know about.
 */
public interface FlowEngine {

    /**
     * Creates an active flow at round zero. Does not run a round.
     *
     * @throws IllegalArgumentException if the request is incomplete or its round budget is below one
     */
    ConversationFlow startFlow(FlowStartRequest request);

    /**
     * Runs rounds until the agent waits, completes or fails. A CONTINUE decision runs the
     * next round immediately; on the last allowed round any non-final decision becomes COMPLETE.
     *
     * @throws FlowNotFoundException if the flow does not exist
     * @throws FlowStateException if the flow is not active, belongs to another agent, or has no rounds left
     * @throws ConcurrentFlowUpdateException if the flow changed while the round ran; nothing was sent
     */
    RoundResult executeRound(String flowId, String agentId);

    /**
     * Delivers a reply to a waiting flow and runs the next round.
     *
     * @throws FlowStateException with reason TIMED_OUT, NOT_WAITING, WAIT_MISMATCH or WRONG_AGENT
     */
    RoundResult resumeFlow(String flowId, ResumeEvent event, String agentId);

    /**
     * Current flow. A waiting flow past its deadline is marked timed out first.
     */
    ConversationFlow getFlow(String flowId);

    /**
     * Flows of an agent in the given states (all states when empty), newest first.
     */
    List<ConversationFlow> listFlows(String agentId, Set<FlowState> states);

    /**
     * Marks every waiting flow past its deadline as timed out.
     *
     * @return number of flows that timed out
     */
    int sweepTimeouts();

    /**
     * Operator action: fails a non-terminal flow.
     */
    ConversationFlow failFlow(String flowId, String reason);

    /**
     * Operator action: pushes a waiting flow's deadline back.
     */
    ConversationFlow extendTimeout(String flowId, int minutes);
}
