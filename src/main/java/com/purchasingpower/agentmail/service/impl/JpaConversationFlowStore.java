package com.purchasingpower.agentmail.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.agentmail.config.FlowProperties;
import com.purchasingpower.agentmail.exception.ConcurrentFlowUpdateException;
import com.purchasingpower.agentmail.exception.FlowNotFoundException;
import com.purchasingpower.agentmail.model.flow.ConversationFlow;
import com.purchasingpower.agentmail.model.flow.ConversationFlowEntity;
import com.purchasingpower.agentmail.model.flow.FlowState;
import com.purchasingpower.agentmail.repository.ConversationFlowRepository;
import com.purchasingpower.agentmail.service.ConversationFlowStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Stores flows as JSON rows guarded by a JPA {@code @Version} column.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaConversationFlowStore implements ConversationFlowStore {

    private final ConversationFlowRepository repository;
    private final ObjectMapper objectMapper;
    private final FlowProperties flowProperties;

    @Override
    public ConversationFlow create(ConversationFlow flow) {
        if (repository.existsById(flow.getId())) {
            throw new IllegalStateException("Flow already exists: " + flow.getId());
        }
        ConversationFlowEntity entity = toEntity(flow);
        entity.setVersion(null);
        ConversationFlowEntity saved = repository.saveAndFlush(entity);
        log.debug("💾 Created flow {} (version {})", saved.getId(), saved.getVersion());
        return toFlow(saved);
    }

    @Override
    public Optional<ConversationFlow> getById(String flowId) {
        return repository.findById(flowId).map(this::toFlow);
    }

    @Override
    public List<ConversationFlow> listByAgent(String agentId, Set<FlowState> states) {
        List<ConversationFlowEntity> entities;
        if (states == null || states.isEmpty()) {
            entities = repository.findByAgentIdOrderByCreatedAtDesc(agentId);
        } else {
            Set<String> values = states.stream().map(FlowState::getValue).collect(Collectors.toSet());
            entities = repository.findByAgentIdAndStateInOrderByCreatedAtDesc(agentId, values);
        }
        return entities.stream().map(this::toFlow).collect(Collectors.toList());
    }

    @Override
    public List<ConversationFlow> listExpiredWaiting(Instant now) {
        return repository.findByStateAndTimeoutAtLessThanEqual(FlowState.WAITING.getValue(), now).stream()
                .map(this::toFlow)
                .collect(Collectors.toList());
    }

    @Override
    public ConversationFlow compareAndSet(ConversationFlow flow) {
        ConversationFlowEntity current = repository.findById(flow.getId())
                .orElseThrow(() -> new FlowNotFoundException(flow.getId()));
        if (flow.getVersion() == null || !Objects.equals(current.getVersion(), flow.getVersion())) {
            throw new ConcurrentFlowUpdateException(flow.getId(), null);
        }
        try {
            ConversationFlowEntity saved = repository.saveAndFlush(toEntity(flow));
            return toFlow(saved);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new ConcurrentFlowUpdateException(flow.getId(), e);
        }
    }

    @Override
    public ConversationFlow update(String flowId, Consumer<ConversationFlow> mutator) {
        int attempts = flowProperties.getUpdateRetries();
        for (int attempt = 1; ; attempt++) {
            ConversationFlow flow = getById(flowId).orElseThrow(() -> new FlowNotFoundException(flowId));
            mutator.accept(flow);
            try {
                return compareAndSet(flow);
            } catch (ConcurrentFlowUpdateException e) {
                if (attempt >= attempts) {
                    log.warn("⚠️ Giving up on flow {} after {} conflicting writes", flowId, attempt);
                    throw e;
                }
                log.debug("Flow {} changed underneath us, retrying ({}/{})", flowId, attempt, attempts);
            }
        }
    }

    private ConversationFlowEntity toEntity(ConversationFlow flow) {
        return ConversationFlowEntity.builder()
                .id(flow.getId())
                .agentId(flow.getAgentId())
                .userId(flow.getUserId())
                .state(flow.getState().getValue())
                .conversationId(flow.getConversationId())
                .round(flow.getRound())
                .timeoutAt(flow.getTimeoutAt())
                .flowJson(writeJson(flow))
                .version(flow.getVersion())
                .createdAt(flow.getCreatedAt())
                .updatedAt(flow.getUpdatedAt())
                .build();
    }

    private ConversationFlow toFlow(ConversationFlowEntity entity) {
        try {
            ConversationFlow flow = objectMapper.readValue(entity.getFlowJson(), ConversationFlow.class);
            flow.setVersion(entity.getVersion());
            return flow;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize flow " + entity.getId(), e);
        }
    }

    private String writeJson(ConversationFlow flow) {
        try {
            return objectMapper.writeValueAsString(flow);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize flow " + flow.getId(), e);
        }
    }
}
