package com.purchasingpower.agentmail.model.directory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Mail policy exactly as configured. Values may be missing, malformed or
 * duplicated; {@code MailPolicyEngine.normalizeMailPolicy} turns this into a
 * canonical {@code MailPolicy}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MailPolicyConfig {

    private String inbound;

    private String outbound;

    @Builder.Default
    private List<String> allowedInboundAddresses = new ArrayList<>();

    @Builder.Default
    private List<String> allowedOutboundAddresses = new ArrayList<>();
}
