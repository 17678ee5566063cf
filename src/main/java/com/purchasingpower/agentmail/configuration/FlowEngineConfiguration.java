package com.purchasingpower.agentmail.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Infrastructure beans for the flow engine.
 *
 * <p>All timeout arithmetic goes through the {@link Clock} bean so tests can
 * substitute a controllable clock.
 */
@Configuration
@EnableScheduling
public class FlowEngineConfiguration {

    @Bean
    public Clock flowClock() {
        return Clock.systemUTC();
    }
}
