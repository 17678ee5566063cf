package com.purchasingpower.agentmail.service.routing;

import com.purchasingpower.agentmail.model.flow.ConversationFlow;
import com.purchasingpower.agentmail.model.flow.ResumeEvent;
import lombok.Value;

/**
 * Outcome of routing one inbound message: either it answers a waiting flow, or it is a new request.
 */
@Value
public class RoutingResult {

    private static final RoutingResult NEW_REQUEST = new RoutingResult(false, null, null);

    boolean flowResponse;
    ConversationFlow flow;
    ResumeEvent resumeEvent;

    public static RoutingResult newRequest() {
        return NEW_REQUEST;
    }

    public static RoutingResult resume(ConversationFlow flow, ResumeEvent event) {
        return new RoutingResult(true, flow, event);
    }
}
