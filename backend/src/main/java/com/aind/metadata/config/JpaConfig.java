package com.aind.metadata.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Repository scanning lives here rather than on the application class, so web slice tests
 * start without a persistence context.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.aind.metadata.repository")
public class JpaConfig {
}
