package com.purchasingpower.agentmail.service.policy;

import com.purchasingpower.agentmail.model.directory.MailPolicyConfig;
import com.purchasingpower.agentmail.model.directory.MailPolicyRule;

import java.util.ArrayList;
import java.util.Set;

/**
 * Canonical mail policy: known rules, lowercased de-duplicated allowlists.
 */
public record MailPolicy(
    MailPolicyRule inbound,
    MailPolicyRule outbound,
    Set<String> allowedInboundAddresses,
    Set<String> allowedOutboundAddresses
) {

    public MailPolicyRule rule(MailDirection direction) {
        return direction == MailDirection.INBOUND ? inbound : outbound;
    }

    public Set<String> allowlist(MailDirection direction) {
        return direction == MailDirection.INBOUND ? allowedInboundAddresses : allowedOutboundAddresses;
    }

    /**
     * Converts back to the configuration shape, so normalizing the result again yields the same policy.
     */
    public MailPolicyConfig toConfig() {
        return MailPolicyConfig.builder()
                .inbound(inbound.getValue())
                .outbound(outbound.getValue())
                .allowedInboundAddresses(new ArrayList<>(allowedInboundAddresses))
                .allowedOutboundAddresses(new ArrayList<>(allowedOutboundAddresses))
                .build();
    }
}
