package com.purchasingpower.agentmail.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.agentmail.exception.ToolExecutionException;
import com.purchasingpower.agentmail.model.flow.RoundDecision;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelDecisionParserTest {

    private final ModelDecisionParser parser = new ModelDecisionParser(new ObjectMapper());

    @Test
    void parse_toolCall_shouldReturnToolAndParameters() {
        ModelDecision decision = parser.parse("{\"tool\": \"current_time\", \"parameters\": {\"zone\": \"Europe/Berlin\"}}");

        assertThat(decision.isToolCall()).isTrue();
        assertThat(decision.getToolName()).isEqualTo("current_time");
        assertThat(decision.getToolParameters()).containsEntry("zone", "Europe/Berlin");
    }

    @Test
    void parse_decisionWrappedInProse_shouldExtractJson() {
        // Given
        String response = "Sure, here is my answer:\n```json\n"
                + "{\"decision\": \"complete\", \"reasoning\": \"known\", \"reply\": \"Refund issued.\", \"confidence\": 0.9}\n"
                + "```";

        // When
        ModelDecision decision = parser.parse(response);

        // Then
        assertThat(decision.isToolCall()).isFalse();
        assertThat(decision.getDecision()).isEqualTo(RoundDecision.COMPLETE);
        assertThat(decision.getReply()).isEqualTo("Refund issued.");
        assertThat(decision.getConfidence()).isEqualTo(0.9);
    }

    @Test
    void parse_waitForAgent_shouldReadTargetAgent() {
        ModelDecision decision = parser.parse("{\"decision\": \"WAIT_FOR_AGENT\", \"reasoning\": \"finance knows\","
                + " \"target_agent\": {\"agent_email\": \"finance@agents.acme.test\","
                + " \"message_subject\": \"Refund status\", \"message_body\": \"Was it issued?\"}}");

        assertThat(decision.getDecision()).isEqualTo(RoundDecision.WAIT_FOR_AGENT);
        assertThat(decision.getDelegation().getAgentEmail()).isEqualTo("finance@agents.acme.test");
        assertThat(decision.getDelegation().getSubject()).isEqualTo("Refund status");
        assertThat(decision.getDelegation().getQuestion()).isEqualTo("Was it issued?");
    }

    @Test
    void parse_finalResponseField_shouldBeUsedAsReply() {
        ModelDecision decision = parser.parse("{\"decision\": \"COMPLETE\", \"final_response\": \"Done.\"}");

        assertThat(decision.getReply()).isEqualTo("Done.");
        assertThat(decision.getDelegation()).isNull();
    }

    @Test
    void parse_invalidOutput_shouldThrow() {
        assertThatThrownBy(() -> parser.parse("I think the refund was issued."))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("no JSON");
        assertThatThrownBy(() -> parser.parse("{\"decision\": \"ESCALATE\"}"))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("ESCALATE");
        assertThatThrownBy(() -> parser.parse("{decision: COMPLETE"))
                .isInstanceOf(ToolExecutionException.class);
    }
}
