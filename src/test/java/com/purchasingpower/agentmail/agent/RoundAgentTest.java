package com.purchasingpower.agentmail.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.agentmail.agent.impl.RegisteredToolGateway;
import com.purchasingpower.agentmail.agent.tools.CurrentTimeTool;
import com.purchasingpower.agentmail.agent.tools.ListAgentsTool;
import com.purchasingpower.agentmail.client.LLMProvider;
import com.purchasingpower.agentmail.config.FlowProperties;
import com.purchasingpower.agentmail.exception.ToolExecutionException;
import com.purchasingpower.agentmail.model.directory.DirectoryContext;
import com.purchasingpower.agentmail.model.flow.ConversationFlow;
import com.purchasingpower.agentmail.model.flow.RoundDecision;
import com.purchasingpower.agentmail.model.flow.ToolCallRecord;
import com.purchasingpower.agentmail.model.mail.Email;
import com.purchasingpower.agentmail.service.PromptLibraryService;
import com.purchasingpower.agentmail.support.MutableClock;
import com.purchasingpower.agentmail.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoundAgentTest {

    private static final String LIST_AGENTS = "{\"tool\": \"list_agents\", \"parameters\": {}}";
    private static final String COMPLETE = "{\"decision\": \"COMPLETE\", \"reasoning\": \"done\", \"reply\": \"Ask finance.\"}";

    private final DirectoryContext directory = TestFixtures.directory();
    private ScriptedModel model;
    private FlowProperties properties;
    private RoundAgent roundAgent;
    private ConversationFlow flow;

    /**
     * Returns canned responses in order and records every prompt it was given.
     */
    private static class ScriptedModel implements LLMProvider {
        private final Deque<String> responses = new ArrayDeque<>();
        private final List<String> prompts = new ArrayList<>();

        void willAnswer(String... answers) {
            responses.addAll(List.of(answers));
        }

        @Override
        public String chat(String prompt, String agentName, String conversationId) {
            prompts.add(prompt);
            if (responses.isEmpty()) {
                throw new IllegalStateException("model unavailable");
            }
            return responses.poll();
        }

        @Override
        public String getProviderName() {
            return "scripted";
        }
    }

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        MutableClock clock = new MutableClock(TestFixtures.START);
        model = new ScriptedModel();
        properties = new FlowProperties();
        PromptLibraryService prompts = new PromptLibraryService();
        prompts.loadPrompts();
        RegisteredToolGateway gateway = new RegisteredToolGateway(
                List.of(new ListAgentsTool(() -> directory), new CurrentTimeTool(clock)));
        roundAgent = new RoundAgent(model, prompts, gateway, new ModelDecisionParser(objectMapper),
                objectMapper, properties, clock);

        Email trigger = TestFixtures.email("root@acme.test", TestFixtures.ALICE, TestFixtures.SUPPORT_ADDRESS,
                "Refund", "Where is my refund?");
        flow = ConversationFlow.start("flow-support-test0001", TestFixtures.startRequest("support", trigger, 3),
                "root@acme.test", TestFixtures.START);
    }

    @Test
    void runRound_directDecision_shouldCallModelOnce() {
        // Given
        model.willAnswer(COMPLETE);

        // When
        RoundOutcome outcome = roundAgent.runRound(flow, TestFixtures.support(), directory);

        // Then
        assertThat(outcome.getDecision().getDecision()).isEqualTo(RoundDecision.COMPLETE);
        assertThat(outcome.getToolCalls()).isEmpty();
        assertThat(model.prompts).hasSize(1);
        String prompt = model.prompts.get(0);
        assertThat(prompt)
                .contains("You are Support Agent <support@agents.acme.test>")
                .contains("This is round 1 of at most 3.")
                .contains("Where is my refund?")
                .contains("- Finance Agent <finance@agents.acme.test>")
                .contains("list_agents");
    }

    @Test
    void runRound_toolCall_shouldFeedResultBackToModel() {
        // Given
        model.willAnswer(LIST_AGENTS, COMPLETE);

        // When
        RoundOutcome outcome = roundAgent.runRound(flow, TestFixtures.support(), directory);

        // Then
        assertThat(outcome.getDecision().getReply()).isEqualTo("Ask finance.");
        assertThat(outcome.getToolCalls()).hasSize(1);
        ToolCallRecord call = outcome.getToolCalls().get(0);
        assertThat(call.getToolName()).isEqualTo("list_agents");
        assertThat(call.isSuccess()).isTrue();
        assertThat(call.getSummary()).isEqualTo("1 agents on team acme");
        assertThat(model.prompts.get(1))
                .contains("Tool results so far in this round")
                .contains("finance@agents.acme.test");
    }

    @Test
    void runRound_toolNotConfiguredForAgent_shouldRecordFailureAndContinue() {
        // Given - support is not configured with current_time
        model.willAnswer("{\"tool\": \"current_time\", \"parameters\": {}}", COMPLETE);

        // When
        RoundOutcome outcome = roundAgent.runRound(flow, TestFixtures.support(), directory);

        // Then
        assertThat(outcome.getToolCalls()).hasSize(1);
        assertThat(outcome.getToolCalls().get(0).isSuccess()).isFalse();
        assertThat(outcome.getToolCalls().get(0).getError()).contains("not available");
    }

    @Test
    void runRound_toolBudgetUsedUp_shouldAskForDecisionWithoutTools() {
        // Given
        properties.setMaxToolIterations(2);
        model.willAnswer(LIST_AGENTS, LIST_AGENTS, COMPLETE);

        // When
        RoundOutcome outcome = roundAgent.runRound(flow, TestFixtures.support(), directory);

        // Then
        assertThat(outcome.getToolCalls()).hasSize(2);
        assertThat(model.prompts).hasSize(3);
        assertThat(model.prompts.get(2)).contains("You may not call any more tools in this round.");
        assertThat(outcome.getDecision().getDecision()).isEqualTo(RoundDecision.COMPLETE);
    }

    @Test
    void runRound_modelKeepsCallingTools_shouldThrow() {
        properties.setMaxToolIterations(1);
        model.willAnswer(LIST_AGENTS, LIST_AGENTS);

        assertThatThrownBy(() -> roundAgent.runRound(flow, TestFixtures.support(), directory))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("kept requesting tools");
    }

    @Test
    void runRound_modelUnavailable_shouldThrowToolExecutionException() {
        assertThatThrownBy(() -> roundAgent.runRound(flow, TestFixtures.support(), directory))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("model unavailable");
    }

    @Test
    void runRound_lastRound_shouldHideDelegationTargets() {
        ConversationFlow lastRound = ConversationFlow.start("flow-support-test0002",
                TestFixtures.startRequest("support", flow.getTrigger(), 1), "root@acme.test", TestFixtures.START);
        model.willAnswer(COMPLETE);

        roundAgent.runRound(lastRound, TestFixtures.support(), directory);

        assertThat(model.prompts.get(0))
                .contains("This is your LAST round")
                .doesNotContain("Agents you can ask");
    }
}
