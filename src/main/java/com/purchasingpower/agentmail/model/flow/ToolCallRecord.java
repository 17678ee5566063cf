package com.purchasingpower.agentmail.model.flow;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class ToolCallRecord {
    String toolName;

    @Builder.Default
    Map<String, Object> arguments = Map.of();

    boolean success;
    String summary;
    String error;
    Instant timestamp;
}
