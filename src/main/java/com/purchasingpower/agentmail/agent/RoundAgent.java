package com.purchasingpower.agentmail.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.agentmail.client.LLMProvider;
import com.purchasingpower.agentmail.config.FlowProperties;
import com.purchasingpower.agentmail.exception.ToolExecutionException;
import com.purchasingpower.agentmail.model.directory.AgentProfile;
import com.purchasingpower.agentmail.model.directory.DirectoryContext;
import com.purchasingpower.agentmail.model.flow.ConversationFlow;
import com.purchasingpower.agentmail.model.flow.RoundRecord;
import com.purchasingpower.agentmail.model.flow.ToolCallRecord;
import com.purchasingpower.agentmail.model.mail.Email;
import com.purchasingpower.agentmail.service.PromptLibraryService;
import com.purchasingpower.agentmail.util.LogFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs one round of a flow against the model.
 *
 * <p>The model sees the agent persona, the flow history and the new input, and answers with
 * either a tool call or a decision. Tool calls are executed and their results fed back until
 * the model decides or the per-round tool budget is used up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoundAgent {

    static final String TEMPLATE = "flow-round";
    private static final int BODY_LIMIT = 4000;

    private final LLMProvider llmProvider;
    private final PromptLibraryService promptLibrary;
    private final ToolExecutionGateway toolGateway;
    private final ModelDecisionParser decisionParser;
    private final ObjectMapper objectMapper;
    private final FlowProperties flowProperties;
    private final Clock clock;

    /**
     * @throws ToolExecutionException if the model, a tool or the model's output fails
     */
    public RoundOutcome runRound(ConversationFlow flow, AgentProfile agent, DirectoryContext directory) {
        ToolContext context = ToolContext.builder()
                .flowId(flow.getId())
                .agentId(agent.getId())
                .teamId(agent.getTeamId())
                .userId(flow.getUserId())
                .allowedTools(new LinkedHashSet<>(agent.getTools()))
                .build();

        Map<String, Object> variables = baseVariables(flow, agent, directory, context);
        List<ToolCallRecord> toolCalls = new ArrayList<>();
        List<Map<String, Object>> toolResults = new ArrayList<>();
        int maxIterations = flowProperties.getMaxToolIterations();
        String agentName = "FlowRound-" + agent.getUsername();

        for (int i = 0; i <= maxIterations; i++) {
            boolean toolsExhausted = i == maxIterations;
            variables.put("toolResults", toolResults);
            variables.put("hasToolResults", !toolResults.isEmpty());
            variables.put("toolsExhausted", toolsExhausted);

            ModelDecision decision = decisionParser.parse(callModel(promptLibrary.render(TEMPLATE, variables), agentName, flow.getId()));
            if (!decision.isToolCall()) {
                log.info("🧠 Round {} of flow {} decided {} ({} tool calls)",
                        flow.getRound() + 1, flow.getId(), decision.getDecision(), toolCalls.size());
                return RoundOutcome.builder().decision(decision).toolCalls(toolCalls).build();
            }
            if (toolsExhausted) {
                break;
            }

            log.info("Executing tool: {}", decision.getToolName());
            ToolResult result = toolGateway.execute(decision.getToolName(), decision.getToolParameters(), context);
            toolCalls.add(ToolCallRecord.builder()
                    .toolName(decision.getToolName())
                    .arguments(decision.getToolParameters() == null ? Map.of() : decision.getToolParameters())
                    .success(result.isSuccess())
                    .summary(result.getSummary())
                    .error(result.getError())
                    .timestamp(clock.instant())
                    .build());
            toolResults.add(Map.of(
                    "name", decision.getToolName(),
                    "success", result.isSuccess(),
                    "output", result.isSuccess() ? toJson(result.getData()) : String.valueOf(result.getError())));
        }

        throw new ToolExecutionException("Model kept requesting tools after " + maxIterations + " iterations", null);
    }

    private String callModel(String prompt, String agentName, String flowId) {
        try {
            return llmProvider.chat(prompt, agentName, flowId);
        } catch (RuntimeException e) {
            throw new ToolExecutionException("Model call failed: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> baseVariables(ConversationFlow flow, AgentProfile agent,
                                              DirectoryContext directory, ToolContext context) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("agentName", agent.displayName());
        variables.put("agentAddress", directory.agentAddress(agent));
        variables.put("persona", agent.getPrompt() == null ? "" : agent.getPrompt());
        variables.put("round", flow.getRound() + 1);
        variables.put("maxRounds", flow.getMaxRounds());
        variables.put("isLastRound", flow.isLastRound());
        variables.put("requesterName", flow.getRequester() == null ? "" : flow.getRequester().getName());
        variables.put("requesterAddress", flow.getRequester() == null ? "" : flow.getRequester().getAddress());
        variables.put("isDelegated", flow.getDelegation() != null);
        variables.put("trigger", mail(flow.getTrigger()));

        List<Map<String, Object>> history = flow.getHistory().stream()
                .map(this::historyEntry)
                .collect(Collectors.toList());
        variables.put("history", history);
        variables.put("hasHistory", !history.isEmpty());

        Email input = flow.getNextInput();
        variables.put("hasInput", input != null && flow.getRound() > 0);
        variables.put("input", input == null ? Map.of() : mail(input));
        variables.put("inputKind", flow.getNextInputKind().name());

        List<Map<String, Object>> tools = toolGateway.availableTools(context).stream()
                .map(tool -> Map.<String, Object>of(
                        "name", tool.getName(),
                        "description", tool.getDescription(),
                        "schema", tool.getParameterSchema()))
                .collect(Collectors.toList());
        variables.put("tools", tools);
        variables.put("hasTools", !tools.isEmpty());

        boolean canDelegate = agent.getMultiRound().isCanCommunicateWithAgents() && !flow.isLastRound();
        variables.put("canDelegate", canDelegate);
        variables.put("agents", canDelegate ? delegationTargets(agent, directory) : List.of());
        return variables;
    }

    private List<Map<String, Object>> delegationTargets(AgentProfile agent, DirectoryContext directory) {
        List<String> allowed = agent.getMultiRound().getAllowedAgentUsernames();
        return directory.getAgents().stream()
                .filter(other -> !other.getId().equals(agent.getId()))
                .filter(other -> allowed == null || allowed.isEmpty()
                        || allowed.stream().anyMatch(u -> u.equalsIgnoreCase(other.getUsername())))
                .filter(other -> directory.agentAddress(other) != null)
                .map(other -> Map.<String, Object>of("name", other.displayName(), "email", directory.agentAddress(other)))
                .collect(Collectors.toList());
    }

    private Map<String, Object> historyEntry(RoundRecord record) {
        Map<String, Object> entry = new HashMap<>();
        entry.put("number", record.getIndex() + 1);
        entry.put("kind", record.getInputKind().name());
        entry.put("hasInput", record.getInput() != null);
        entry.put("input", record.getInput() == null ? Map.of() : mail(record.getInput()));
        entry.put("decision", record.getDecision().name());
        entry.put("reasoning", record.getReasoning() == null ? "" : record.getReasoning());
        entry.put("reply", record.getReply() == null ? "" : record.getReply());
        entry.put("tools", record.getToolCalls().stream().map(ToolCallRecord::getToolName).collect(Collectors.joining(", ")));
        return entry;
    }

    private Map<String, Object> mail(Email email) {
        return Map.of(
                "from", nullToEmpty(email.getFrom()),
                "subject", nullToEmpty(email.getSubject()),
                "body", LogFormat.truncate(nullToEmpty(email.getBody()), BODY_LIMIT));
    }

    private String toJson(Object data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            return String.valueOf(data);
        }
    }

    private String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
