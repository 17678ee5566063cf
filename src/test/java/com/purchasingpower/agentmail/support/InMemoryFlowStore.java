package com.purchasingpower.agentmail.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.purchasingpower.agentmail.exception.ConcurrentFlowUpdateException;
import com.purchasingpower.agentmail.exception.FlowNotFoundException;
import com.purchasingpower.agentmail.model.flow.ConversationFlow;
import com.purchasingpower.agentmail.model.flow.FlowState;
import com.purchasingpower.agentmail.service.ConversationFlowStore;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Store that keeps flows as JSON in memory, with the same version semantics as the JPA store.
 * Every read returns an independent copy.
 */
public class InMemoryFlowStore implements ConversationFlowStore {

    public static final ObjectMapper MAPPER = JsonMapper.builder().findAndAddModules().build();

    private final Map<String, String> json = new ConcurrentHashMap<>();
    private final Map<String, Long> versions = new ConcurrentHashMap<>();

    @Override
    public synchronized ConversationFlow create(ConversationFlow flow) {
        if (json.containsKey(flow.getId())) {
            throw new IllegalStateException("Flow already exists: " + flow.getId());
        }
        json.put(flow.getId(), write(flow));
        versions.put(flow.getId(), 0L);
        return read(flow.getId());
    }

    @Override
    public Optional<ConversationFlow> getById(String flowId) {
        return json.containsKey(flowId) ? Optional.of(read(flowId)) : Optional.empty();
    }

    @Override
    public List<ConversationFlow> listByAgent(String agentId, Set<FlowState> states) {
        return json.keySet().stream()
                .map(this::read)
                .filter(flow -> flow.getAgentId().equals(agentId))
                .filter(flow -> states == null || states.isEmpty() || states.contains(flow.getState()))
                .sorted(Comparator.comparing(ConversationFlow::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public List<ConversationFlow> listExpiredWaiting(Instant now) {
        return json.keySet().stream()
                .map(this::read)
                .filter(flow -> flow.isTimeoutDue(now))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized ConversationFlow compareAndSet(ConversationFlow flow) {
        Long current = versions.get(flow.getId());
        if (current == null) {
            throw new FlowNotFoundException(flow.getId());
        }
        if (!current.equals(flow.getVersion())) {
            throw new ConcurrentFlowUpdateException(flow.getId(), null);
        }
        json.put(flow.getId(), write(flow));
        versions.put(flow.getId(), current + 1);
        return read(flow.getId());
    }

    @Override
    public ConversationFlow update(String flowId, Consumer<ConversationFlow> mutator) {
        for (int attempt = 1; ; attempt++) {
            ConversationFlow flow = getById(flowId).orElseThrow(() -> new FlowNotFoundException(flowId));
            mutator.accept(flow);
            try {
                return compareAndSet(flow);
            } catch (ConcurrentFlowUpdateException e) {
                if (attempt >= 3) {
                    throw e;
                }
            }
        }
    }

    public int size() {
        return json.size();
    }

    private synchronized ConversationFlow read(String flowId) {
        try {
            ConversationFlow flow = MAPPER.readValue(json.get(flowId), ConversationFlow.class);
            flow.setVersion(versions.get(flowId));
            return flow;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    private String write(ConversationFlow flow) {
        try {
            return MAPPER.writeValueAsString(flow);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }
}
