package com.quantinfo.collector.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * JPA setup: repositories, audit timestamps on instruments, and declarative transactions.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.quantinfo.collector.repository")
@EnableJpaAuditing
@EnableTransactionManagement
public class JpaConfig {
}
