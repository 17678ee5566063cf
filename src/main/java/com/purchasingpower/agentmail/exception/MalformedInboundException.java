package com.purchasingpower.agentmail.exception;

/**
 * Webhook payload without the fields needed to build an email.
 */
public class MalformedInboundException extends RuntimeException {

    public MalformedInboundException(String message) {
        super(message);
    }
}
