package com.purchasingpower.agentmail.service.impl;

import com.purchasingpower.agentmail.service.FlowEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically times out waiting flows whose deadline has passed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.flow", name = "timeout-sweep-enabled", havingValue = "true", matchIfMissing = true)
public class TimeoutSweepJob {

    private final FlowEngine flowEngine;

    @Scheduled(fixedDelayString = "${app.flow.timeout-sweep-interval:PT5M}",
            initialDelayString = "${app.flow.timeout-sweep-interval:PT5M}")
    public void sweep() {
        log.debug("Running timeout sweep");
        flowEngine.sweepTimeouts();
    }
}
