package com.purchasingpower.agentmail.controller;

import com.purchasingpower.agentmail.model.dto.FlowActionRequest;
import com.purchasingpower.agentmail.model.flow.ConversationFlow;
import com.purchasingpower.agentmail.model.flow.FlowState;
import com.purchasingpower.agentmail.service.FlowEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Operator endpoints for inspecting and repairing conversation flows.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/agent-flows")
@RequiredArgsConstructor
public class AgentFlowController {

    private final FlowEngine flowEngine;

    /**
     * GET /api/v1/agent-flows?agentId=support&amp;state=waiting,active&amp;limit=20
     */
    @GetMapping
    public ResponseEntity<List<ConversationFlow>> listFlows(
            @RequestParam String agentId,
            @RequestParam(required = false) String state,
            @RequestParam(defaultValue = "50") int limit) {
        List<ConversationFlow> flows = flowEngine.listFlows(agentId, parseStates(state)).stream()
                .limit(Math.max(1, limit))
                .collect(Collectors.toList());
        return ResponseEntity.ok(flows);
    }

    @GetMapping("/{flowId}")
    public ResponseEntity<ConversationFlow> getFlow(@PathVariable String flowId) {
        return ResponseEntity.ok(flowEngine.getFlow(flowId));
    }

    @PostMapping("/{flowId}/fail")
    public ResponseEntity<ConversationFlow> failFlow(@PathVariable String flowId,
                                                     @RequestBody(required = false) FlowActionRequest request) {
        String reason = request == null ? null : request.getReason();
        return ResponseEntity.ok(flowEngine.failFlow(flowId, reason));
    }

    @PostMapping("/{flowId}/extend-timeout")
    public ResponseEntity<ConversationFlow> extendTimeout(@PathVariable String flowId,
                                                          @Valid @RequestBody FlowActionRequest request) {
        if (request.getMinutes() == null) {
            throw new IllegalArgumentException("minutes is required");
        }
        return ResponseEntity.ok(flowEngine.extendTimeout(flowId, request.getMinutes()));
    }

    @PostMapping("/timeouts/sweep")
    public ResponseEntity<Map<String, Integer>> sweepTimeouts() {
        int timedOut = flowEngine.sweepTimeouts();
        log.info("Manual timeout sweep closed {} flows", timedOut);
        return ResponseEntity.ok(Map.of("timedOut", timedOut));
    }

    private Set<FlowState> parseStates(String state) {
        if (state == null || state.isBlank()) {
            return EnumSet.noneOf(FlowState.class);
        }
        return Arrays.stream(state.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(FlowState::fromValue)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(FlowState.class)));
    }
}
