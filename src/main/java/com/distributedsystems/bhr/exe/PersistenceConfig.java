package com.distributedsystems.bhr.exe;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@Configuration
@EnableTransactionManagement
@EnableJpaRepositories(basePackages = "com.distributedsystems.bhr.repository")
@EntityScan(basePackages = "com.distributedsystems.bhr.model")
public class PersistenceConfig {
}
