package com.purchasingpower.agentmail.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tunables for the conversation flow engine.
 *
 * <p>Bound from {@code app.flow.*}. Per-agent {@code multiRound} settings in the
 * directory take precedence over the defaults declared here.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.flow")
public class FlowProperties {

    /**
     * Round budget for agents that do not declare their own.
     */
    @Min(1)
    private int defaultMaxRounds = 1;

    /**
     * Minutes a flow may wait for a user reply before it times out.
     */
    @Min(1)
    private int defaultTimeoutMinutes = 30;

    /**
     * Minutes a flow may wait for another agent's reply.
     */
    @Min(1)
    private int delegationTimeoutMinutes = 30;

    /**
     * Upper bound on model/tool exchanges inside a single round.
     */
    @Min(1)
    private int maxToolIterations = 5;

    /**
     * Longest chain of agent-to-agent delegations a single user request may spawn.
     */
    @Min(1)
    private int maxDelegationDepth = 3;

    private boolean sendTimeoutNotice = true;

    private boolean sendFailureNotice = true;

    private boolean timeoutSweepEnabled = true;

    private Duration timeoutSweepInterval = Duration.ofMinutes(5);

    /**
     * Maximum number of References entries inspected per message.
     */
    @Min(1)
    private int referenceLookback = 50;

    /**
     * Read-modify-write attempts before a concurrent update is reported.
     */
    @Min(1)
    private int updateRetries = 3;

    /**
     * Sender address used when an agent's team has no mail domain.
     */
    @NotBlank
    private String systemAddress = "agents@agentmail.local";
}
