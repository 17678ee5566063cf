package com.purchasingpower.agentmail.service.policy;

public enum MailDirection {
    INBOUND("inbound"),
    OUTBOUND("outbound");

    private final String value;

    MailDirection(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
