package com.purchasingpower.agentmail.service.policy;

/**
 * Result of a mail policy check. {@code reason} is a machine-readable code for logs;
 * it is never sent to the remote party.
 */
public record PolicyDecision(boolean allowed, String reason) {

    public static PolicyDecision allow(String reason) {
        return new PolicyDecision(true, reason);
    }

    public static PolicyDecision deny(MailDirection direction, String code) {
        return new PolicyDecision(false, direction.getValue() + "_blocked:" + code);
    }
}
