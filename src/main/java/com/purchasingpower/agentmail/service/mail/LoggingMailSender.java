package com.purchasingpower.agentmail.service.mail;

import com.purchasingpower.agentmail.model.mail.OutboundEmail;
import com.purchasingpower.agentmail.util.LogFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Development transport: writes outbound mail to the log instead of delivering it.
 */
@Slf4j
@Component
public class LoggingMailSender implements MailSender {

    @Override
    public String send(OutboundEmail email) {
        log.info("📧 [DEV MAIL] {} -> {} | {} | id={} | inReplyTo={}",
                email.getFrom(), email.getTo(), email.getSubject(), email.getMessageId(), email.getInReplyTo());
        log.debug("📧 [DEV MAIL] body: {}", LogFormat.truncate(email.getBody(), 2000));
        return email.getMessageId();
    }
}
