package com.purchasingpower.agentmail.service.impl;

import com.purchasingpower.agentmail.config.ConfigurationPropertiesEnablerConfig;
import com.purchasingpower.agentmail.exception.ConcurrentFlowUpdateException;
import com.purchasingpower.agentmail.exception.FlowNotFoundException;
import com.purchasingpower.agentmail.model.flow.AgentResponseWait;
import com.purchasingpower.agentmail.model.flow.ConversationFlow;
import com.purchasingpower.agentmail.model.flow.EmailResponseWait;
import com.purchasingpower.agentmail.model.flow.FlowState;
import com.purchasingpower.agentmail.model.flow.RoundDecision;
import com.purchasingpower.agentmail.model.flow.RoundInputKind;
import com.purchasingpower.agentmail.model.flow.RoundRecord;
import com.purchasingpower.agentmail.model.flow.ToolCallRecord;
import com.purchasingpower.agentmail.model.mail.Email;
import com.purchasingpower.agentmail.repository.ConversationFlowRepository;
import com.purchasingpower.agentmail.support.TestFixtures;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.json.AutoConfigureJson;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.purchasingpower.agentmail.support.TestFixtures.ALICE;
import static com.purchasingpower.agentmail.support.TestFixtures.SUPPORT_ADDRESS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@AutoConfigureJson
@ActiveProfiles("test")
@Import({JpaConversationFlowStore.class, ConfigurationPropertiesEnablerConfig.class})
class JpaConversationFlowStoreTest {

    @Autowired
    private JpaConversationFlowStore store;

    @Autowired
    private ConversationFlowRepository repository;

    private ConversationFlow newFlow(String id, String agentId, Instant createdAt) {
        Email trigger = TestFixtures.email(id + "@acme.test", ALICE, SUPPORT_ADDRESS, "Refund", "Where is my refund?");
        return ConversationFlow.start(id, TestFixtures.startRequest(agentId, trigger, 3), trigger.getMessageId(), createdAt);
    }

    @Test
    void create_shouldPersistJsonAndLookupColumns() {
        // When
        ConversationFlow created = store.create(newFlow("flow-support-aaaa0001", "support", TestFixtures.START));

        // Then
        assertThat(created.getVersion()).isZero();
        assertThat(repository.findById("flow-support-aaaa0001")).hasValueSatisfying(entity -> {
            assertThat(entity.getAgentId()).isEqualTo("support");
            assertThat(entity.getState()).isEqualTo("active");
            assertThat(entity.getFlowJson()).contains("\"agentId\":\"support\"");
        });
    }

    @Test
    void create_duplicateId_shouldFail() {
        store.create(newFlow("flow-support-aaaa0002", "support", TestFixtures.START));

        assertThatThrownBy(() -> store.create(newFlow("flow-support-aaaa0002", "support", TestFixtures.START)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void compareAndSet_shouldKeepFullFlowIncludingWaitAndHistory() {
        // Given
        ConversationFlow flow = store.create(newFlow("flow-support-aaaa0003", "support", TestFixtures.START));
        Instant now = TestFixtures.START.plusSeconds(5);
        flow.appendRound(RoundRecord.builder()
                .index(0)
                .inputKind(RoundInputKind.TRIGGER)
                .toolCalls(List.of(ToolCallRecord.builder()
                        .toolName("list_agents")
                        .arguments(Map.of("team", "acme"))
                        .success(true)
                        .summary("2 agents")
                        .timestamp(now)
                        .build()))
                .decision(RoundDecision.WAIT_FOR_AGENT)
                .reasoning("finance knows")
                .reply("Was the refund issued?")
                .timestamp(now)
                .build(), now);
        flow.waitFor(new AgentResponseWait("abc123def456", "finance", "finance@agents.acme.test", "deleg-1@agents.acme.test"),
                now.plus(Duration.ofMinutes(30)), now);

        // When
        ConversationFlow saved = store.compareAndSet(flow);

        // Then
        assertThat(saved.getVersion()).isEqualTo(1L);
        ConversationFlow loaded = store.getById("flow-support-aaaa0003").orElseThrow();
        assertThat(loaded.getState()).isEqualTo(FlowState.WAITING);
        assertThat(loaded.getWaitingFor()).isInstanceOf(AgentResponseWait.class);
        assertThat(((AgentResponseWait) loaded.getWaitingFor()).requestId()).isEqualTo("abc123def456");
        assertThat(loaded.getHistory()).hasSize(1);
        assertThat(loaded.getHistory().get(0).getToolCalls().get(0).getToolName()).isEqualTo("list_agents");
        assertThat(loaded.getTrigger().getBody()).isEqualTo("Where is my refund?");
    }

    @Test
    void compareAndSet_staleVersion_shouldBeRejected() {
        // Given - two readers of the same version
        store.create(newFlow("flow-support-aaaa0004", "support", TestFixtures.START));
        ConversationFlow first = store.getById("flow-support-aaaa0004").orElseThrow();
        ConversationFlow second = store.getById("flow-support-aaaa0004").orElseThrow();

        // When
        first.addThreadMessageId("a@acme.test");
        store.compareAndSet(first);
        second.addThreadMessageId("b@acme.test");

        // Then
        assertThatThrownBy(() -> store.compareAndSet(second)).isInstanceOf(ConcurrentFlowUpdateException.class);
        assertThat(store.getById("flow-support-aaaa0004").orElseThrow().getThreadMessageIds())
                .contains("a@acme.test")
                .doesNotContain("b@acme.test");
    }

    @Test
    void update_missingFlow_shouldThrowNotFound() {
        assertThatThrownBy(() -> store.update("flow-missing", flow -> { }))
                .isInstanceOf(FlowNotFoundException.class);
    }

    @Test
    void listByAgent_shouldFilterByStateNewestFirst() {
        // Given
        store.create(newFlow("flow-support-aaaa0005", "support", TestFixtures.START));
        store.create(newFlow("flow-support-aaaa0006", "support", TestFixtures.START.plusSeconds(60)));
        store.create(newFlow("flow-finance-aaaa0007", "finance", TestFixtures.START));
        store.update("flow-support-aaaa0005", flow -> flow.waitFor(new EmailResponseWait("q@agents.acme.test"),
                TestFixtures.START.plus(Duration.ofMinutes(30)), TestFixtures.START));

        // When
        List<ConversationFlow> all = store.listByAgent("support", Set.of());
        List<ConversationFlow> waiting = store.listByAgent("support", Set.of(FlowState.WAITING));

        // Then
        assertThat(all).extracting(ConversationFlow::getId)
                .containsExactly("flow-support-aaaa0006", "flow-support-aaaa0005");
        assertThat(waiting).extracting(ConversationFlow::getId).containsExactly("flow-support-aaaa0005");
    }

    @Test
    void listExpiredWaiting_shouldReturnOnlyDueWaits() {
        store.create(newFlow("flow-support-aaaa0008", "support", TestFixtures.START));
        store.update("flow-support-aaaa0008", flow -> flow.waitFor(new EmailResponseWait("q@agents.acme.test"),
                TestFixtures.START.plus(Duration.ofMinutes(30)), TestFixtures.START));

        assertThat(store.listExpiredWaiting(TestFixtures.START.plus(Duration.ofMinutes(29)))).isEmpty();
        assertThat(store.listExpiredWaiting(TestFixtures.START.plus(Duration.ofMinutes(30))))
                .extracting(ConversationFlow::getId)
                .containsExactly("flow-support-aaaa0008");
    }
}
