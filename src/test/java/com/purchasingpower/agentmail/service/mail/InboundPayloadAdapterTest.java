package com.purchasingpower.agentmail.service.mail;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.agentmail.config.FlowProperties;
import com.purchasingpower.agentmail.exception.MalformedInboundException;
import com.purchasingpower.agentmail.model.mail.Email;
import com.purchasingpower.agentmail.support.MutableClock;
import com.purchasingpower.agentmail.support.TestFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InboundPayloadAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final InboundPayloadAdapter adapter = new InboundPayloadAdapter(
            new ThreadCorrelator(new FlowProperties(), objectMapper), new MutableClock(TestFixtures.START));

    @Test
    void toEmail_providerFields_shouldBeMapped() throws Exception {
        // Given
        String json = "{"
                + "\"sender\": \"Alice Jones <Alice@Acme.test>\","
                + "\"recipient\": \"support@agents.acme.test\","
                + "\"Subject\": \"Refund\","
                + "\"body-plain\": \"Where is my refund?\","
                + "\"Message-Id\": \"<Reply-1@acme.test>\","
                + "\"In-Reply-To\": \"<out-1@agents.acme.test>\","
                + "\"References\": \"<root@acme.test> <out-1@agents.acme.test>\""
                + "}";

        // When
        Email email = adapter.toEmail(objectMapper.readTree(json));

        // Then
        assertThat(email.getMessageId()).isEqualTo("reply-1@acme.test");
        assertThat(email.senderAddress()).isEqualTo("alice@acme.test");
        assertThat(email.recipientAddress()).isEqualTo("support@agents.acme.test");
        assertThat(email.getSubject()).isEqualTo("Refund");
        assertThat(email.getBody()).isEqualTo("Where is my refund?");
        assertThat(email.getInReplyTo()).containsExactly("out-1@agents.acme.test");
        assertThat(email.getConversationId()).isEqualTo("root@acme.test");
        assertThat(email.getReceivedAt()).isEqualTo(TestFixtures.START);
    }

    @Test
    void toEmail_recipientDiffersFromVisibleTo_shouldPreferRecipientAndStrippedParts() throws Exception {
        // Given an agent that was only copied on the mail
        String json = "{"
                + "\"from\": \"alice@acme.test\","
                + "\"To\": \"bob@acme.test\","
                + "\"recipient\": \"support@agents.acme.test\","
                + "\"body-plain\": \"Hi\\n\\n> quoted history\","
                + "\"stripped-text\": \"Hi\","
                + "\"stripped-html\": \"<p>Hi</p>\","
                + "\"body-html\": \"<p>Hi</p><blockquote>quoted history</blockquote>\""
                + "}";

        // When
        Email email = adapter.toEmail(objectMapper.readTree(json));

        // Then
        assertThat(email.recipientAddress()).isEqualTo("support@agents.acme.test");
        assertThat(email.getBody()).isEqualTo("Hi");
        assertThat(email.getHtml()).isEqualTo("<p>Hi</p>");
    }

    @Test
    void toEmail_addressObjects_shouldUseAddressField() throws Exception {
        String json = "{\"from\": {\"name\": \"Alice\", \"address\": \"alice@acme.test\"},"
                + " \"to\": [{\"address\": \"support@agents.acme.test\"}], \"text\": \"hi\"}";

        Email email = adapter.toEmail(objectMapper.readTree(json));

        assertThat(email.senderAddress()).isEqualTo("alice@acme.test");
        assertThat(email.recipientAddress()).isEqualTo("support@agents.acme.test");
        assertThat(email.getMessageId()).isNotBlank();
        assertThat(email.getConversationId()).isEqualTo(email.getMessageId());
        assertThat(email.getSubject()).isEmpty();
    }

    @Test
    void toEmail_missingSender_shouldBeRejected() throws Exception {
        assertThatThrownBy(() -> adapter.toEmail(objectMapper.readTree("{\"to\": \"support@agents.acme.test\"}")))
                .isInstanceOf(MalformedInboundException.class)
                .hasMessageContaining("sender");
        assertThatThrownBy(() -> adapter.toEmail(objectMapper.readTree("{\"from\": \"alice@acme.test\"}")))
                .isInstanceOf(MalformedInboundException.class)
                .hasMessageContaining("recipient");
    }
}
