package com.purchasingpower.agentmail.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MailAddressesTest {

    @Test
    void normalizeSubject_stackedPrefixes_shouldBeStripped() {
        assertThat(MailAddresses.normalizeSubject("Re: Fwd: RE: Refund")).isEqualTo("Refund");
        assertThat(MailAddresses.normalizeSubject("  fw:Aw: SV: Invoice 7 ")).isEqualTo("Invoice 7");
        assertThat(MailAddresses.normalizeSubject("Refund: status")).isEqualTo("Refund: status");
        assertThat(MailAddresses.normalizeSubject(null)).isEmpty();
    }

    @Test
    void replySubject_forwardedSubject_shouldGetSingleReplyPrefix() {
        assertThat(MailAddresses.replySubject("Fwd: Refund")).isEqualTo("Re: Refund");
        assertThat(MailAddresses.replySubject("Re: Re: Refund")).isEqualTo("Re: Refund");
        assertThat(MailAddresses.replySubject("Refund")).isEqualTo("Re: Refund");
        assertThat(MailAddresses.replySubject(" ")).isEqualTo("Re: (no subject)");
    }

    @Test
    void extractAddress_displayNameForm_shouldReturnBareAddress() {
        assertThat(MailAddresses.extractAddress("Alice Jones <alice@acme.test>")).isEqualTo("alice@acme.test");
        assertThat(MailAddresses.localPart("support@agents.acme.test")).isEqualTo("support");
        assertThat(MailAddresses.domain("support@agents.acme.test")).isEqualTo("agents.acme.test");
    }
}
