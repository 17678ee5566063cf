package com.purchasingpower.agentmail.service.mail;

import com.purchasingpower.agentmail.model.mail.OutboundEmail;

/**
 * Outbound mail transport.
 */
public interface MailSender {

    /**
     * Sends the message.
     *
     * @return provider message id, or the message id assigned by the caller
     * @throws RuntimeException if the message could not be handed off
     */
    String send(OutboundEmail email);
}
