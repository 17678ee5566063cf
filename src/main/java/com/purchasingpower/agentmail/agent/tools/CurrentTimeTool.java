package com.purchasingpower.agentmail.agent.tools;

import com.purchasingpower.agentmail.agent.Tool;
import com.purchasingpower.agentmail.agent.ToolContext;
import com.purchasingpower.agentmail.agent.ToolResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class CurrentTimeTool implements Tool {

    private final Clock clock;

    @Override
    public String getName() {
        return "current_time";
    }

    @Override
    public String getDescription() {
        return "Current date and time, optionally in a given IANA time zone such as Europe/Berlin.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"type\":\"object\",\"properties\":{\"zone\":{\"type\":\"string\"}}}";
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        Object zone = parameters.get("zone");
        ZoneId zoneId;
        try {
            zoneId = zone == null ? ZoneId.of("UTC") : ZoneId.of(zone.toString());
        } catch (DateTimeException e) {
            return ToolResult.failure("Unknown time zone: " + zone);
        }
        String now = ZonedDateTime.now(clock.withZone(zoneId)).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        return ToolResult.success(now, "current time in " + zoneId);
    }
}
