package com.purchasingpower.agentmail.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the application's {@code @ConfigurationProperties} classes.
 *
 * <ul>
 *   <li>{@link FlowProperties} - flow engine defaults and sweep settings
 *   <li>{@link DirectoryProperties} - teams, members and agent profiles
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
    FlowProperties.class,
    DirectoryProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
