package com.purchasingpower.agentmail.service.routing;

import com.purchasingpower.agentmail.model.directory.DirectoryContext;
import com.purchasingpower.agentmail.model.flow.AgentResponseWait;
import com.purchasingpower.agentmail.model.flow.ConversationFlow;
import com.purchasingpower.agentmail.model.flow.EmailResponseWait;
import com.purchasingpower.agentmail.model.flow.ResumeEvent;
import com.purchasingpower.agentmail.model.flow.WaitCondition;
import com.purchasingpower.agentmail.model.mail.Email;
import com.purchasingpower.agentmail.service.AgentDirectory;
import com.purchasingpower.agentmail.support.InMemoryFlowStore;
import com.purchasingpower.agentmail.support.MutableClock;
import com.purchasingpower.agentmail.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.purchasingpower.agentmail.support.TestFixtures.ALICE;
import static com.purchasingpower.agentmail.support.TestFixtures.FINANCE_ADDRESS;
import static com.purchasingpower.agentmail.support.TestFixtures.SUPPORT_ADDRESS;
import static org.assertj.core.api.Assertions.assertThat;

class MessageRouterTest {

    private InMemoryFlowStore store;
    private MutableClock clock;
    private AgentDirectory agentDirectory;
    private MessageRouter router;
    private final DirectoryContext directory = TestFixtures.directory();

    @BeforeEach
    void setUp() {
        store = new InMemoryFlowStore();
        clock = new MutableClock(TestFixtures.START);
        agentDirectory = () -> directory;
        router = new MessageRouter(store, agentDirectory, clock);
    }

    private ConversationFlow waitingFlow(String id, String triggerId, WaitCondition wait, Instant createdAt) {
        Email trigger = TestFixtures.email(triggerId, ALICE, SUPPORT_ADDRESS, "Refund", "Where is my refund?");
        ConversationFlow flow = ConversationFlow.start(id, TestFixtures.startRequest("support", trigger, 3),
                triggerId, createdAt);
        flow.waitFor(wait, createdAt.plus(Duration.ofMinutes(30)), createdAt);
        return store.create(flow);
    }

    @Test
    void route_noWaitingFlows_shouldBeNewRequest() {
        // Given
        Email email = TestFixtures.email("m1@acme.test", ALICE, SUPPORT_ADDRESS, "Hello", "Hi");

        // When
        RoutingResult result = router.routeInboundEmail(email, "support");

        // Then
        assertThat(result.isFlowResponse()).isFalse();
        assertThat(result.getFlow()).isNull();
    }

    @Test
    void route_userReplyInSameThread_shouldResumeFlow() {
        // Given
        waitingFlow("flow-support-1", "root@acme.test", new EmailResponseWait("out-1@agents.acme.test"),
                TestFixtures.START);
        Email reply = TestFixtures.reply("r1@acme.test", ALICE, SUPPORT_ADDRESS, "Re: Refund",
                "Order 42", "root@acme.test", "out-1@agents.acme.test");

        // When
        RoutingResult result = router.routeInboundEmail(reply, "support");

        // Then
        assertThat(result.isFlowResponse()).isTrue();
        assertThat(result.getFlow().getId()).isEqualTo("flow-support-1");
        assertThat(result.getResumeEvent().getEmail()).isEqualTo(reply);
    }

    @Test
    void route_replyReferencingKnownMessageWithNewConversationId_shouldStillMatch() {
        // Given
        ConversationFlow flow = ConversationFlow.start("flow-support-2",
                TestFixtures.startRequest("support",
                        TestFixtures.email("root@acme.test", ALICE, SUPPORT_ADDRESS, "Refund", "?"), 3),
                "root@acme.test", TestFixtures.START);
        flow.addThreadMessageId("out-7@agents.acme.test");
        flow.waitFor(new EmailResponseWait("out-7@agents.acme.test"),
                TestFixtures.START.plus(Duration.ofMinutes(30)), TestFixtures.START);
        store.create(flow);
        Email reply = Email.builder()
                .messageId("r2@acme.test")
                .from(ALICE)
                .to(SUPPORT_ADDRESS)
                .subject("Re: Refund")
                .body("here")
                .inReplyTo(List.of("out-7@agents.acme.test"))
                .conversationId("some-other-root@acme.test")
                .build();

        // When
        RoutingResult result = router.routeInboundEmail(reply, "support", directory);

        // Then
        assertThat(result.isFlowResponse()).isTrue();
    }

    @Test
    void route_unrelatedMessage_shouldBeNewRequest() {
        waitingFlow("flow-support-1", "root@acme.test", new EmailResponseWait("out-1@agents.acme.test"),
                TestFixtures.START);
        Email unrelated = TestFixtures.email("fresh@acme.test", ALICE, SUPPORT_ADDRESS, "Another topic", "Hi");

        RoutingResult result = router.routeInboundEmail(unrelated, "support", directory);

        assertThat(result.isFlowResponse()).isFalse();
    }

    @Test
    void route_expiredWait_shouldNotMatch() {
        // Given
        waitingFlow("flow-support-1", "root@acme.test", new EmailResponseWait("out-1@agents.acme.test"),
                TestFixtures.START);
        clock.advance(Duration.ofMinutes(31));
        Email lateReply = TestFixtures.reply("late@acme.test", ALICE, SUPPORT_ADDRESS, "Re: Refund",
                "Sorry for the delay", "root@acme.test", "out-1@agents.acme.test");

        // When
        RoutingResult result = router.routeInboundEmail(lateReply, "support", directory);

        // Then
        assertThat(result.isFlowResponse()).isFalse();
    }

    @Test
    void route_ambiguousMatch_shouldPreferNewestFlow() {
        // Given
        waitingFlow("flow-support-old", "root@acme.test", new EmailResponseWait("out-1@agents.acme.test"),
                TestFixtures.START);
        waitingFlow("flow-support-new", "root@acme.test", new EmailResponseWait("out-2@agents.acme.test"),
                TestFixtures.START.plusSeconds(60));
        Email reply = TestFixtures.reply("r1@acme.test", ALICE, SUPPORT_ADDRESS, "Re: Refund",
                "Answer", "root@acme.test", "root@acme.test");

        // When
        RoutingResult result = router.routeInboundEmail(reply, "support", directory);

        // Then
        assertThat(result.getFlow().getId()).isEqualTo("flow-support-new");
    }

    @Test
    void route_agentReplyWithToken_shouldResumeWithRequestId() {
        // Given
        waitingFlow("flow-support-1", "root@acme.test",
                new AgentResponseWait("abc123def456", "finance", FINANCE_ADDRESS, "deleg-1@agents.acme.test"),
                TestFixtures.START);
        Email reply = TestFixtures.email("fin-1@agents.acme.test", "Finance Agent <" + FINANCE_ADDRESS + ">",
                SUPPORT_ADDRESS, "Re: [REQ-abc123def456] Refund", "Refund was issued on Monday");

        // When
        RoutingResult result = router.routeInboundEmail(reply, "support", directory);

        // Then
        assertThat(result.isFlowResponse()).isTrue();
        ResumeEvent event = result.getResumeEvent();
        assertThat(event.getRequestId()).isEqualTo("abc123def456");
        assertThat(event.getSenderAgentId()).isEqualTo("finance");
    }

    @Test
    void route_agentReplyWithoutTokenButReferencingDelegation_shouldMatch() {
        waitingFlow("flow-support-1", "root@acme.test",
                new AgentResponseWait("abc123def456", "finance", FINANCE_ADDRESS, "deleg-1@agents.acme.test"),
                TestFixtures.START);
        Email reply = TestFixtures.reply("fin-1@agents.acme.test", FINANCE_ADDRESS, SUPPORT_ADDRESS,
                "Re: Refund", "Issued", "deleg-1@agents.acme.test", "deleg-1@agents.acme.test");

        RoutingResult result = router.routeInboundEmail(reply, "support", directory);

        assertThat(result.isFlowResponse()).isTrue();
    }

    @Test
    void route_tokenFromWrongSender_shouldNotMatch() {
        // Given - the user quotes the token, but the request went to finance
        waitingFlow("flow-support-1", "root@acme.test",
                new AgentResponseWait("abc123def456", "finance", FINANCE_ADDRESS, "deleg-1@agents.acme.test"),
                TestFixtures.START);
        Email spoof = TestFixtures.email("x@acme.test", ALICE, SUPPORT_ADDRESS,
                "[REQ-abc123def456] done", "Trust me");

        // When
        RoutingResult result = router.routeInboundEmail(spoof, "support", directory);

        // Then
        assertThat(result.isFlowResponse()).isFalse();
    }

    @Test
    void extractRequestId_shouldAcceptCurrentAndLegacyTokens() {
        assertThat(router.extractRequestId("Re: [REQ-AbC123] Refund")).isEqualTo("abc123");
        assertThat(router.extractRequestId("[Req: req-77x] Refund")).isEqualTo("req-77x");
        assertThat(router.extractRequestId("Refund")).isNull();
        assertThat(router.extractRequestId(null)).isNull();
    }
}
