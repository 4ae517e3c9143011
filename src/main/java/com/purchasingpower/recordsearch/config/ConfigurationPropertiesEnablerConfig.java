package com.purchasingpower.recordsearch.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables the {@code @ConfigurationProperties} classes bound from application.yml.
 *
 * <p>Enabled configuration classes:
 * <ul>
 *   <li>{@link RecordSearchProperties} - query defaults and source aliases
 * </ul>
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    RecordSearchProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
