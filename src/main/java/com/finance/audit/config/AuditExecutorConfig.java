package com.finance.audit.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AuditExecutorConfig {

    // One thread per scanner: crosstab report, time series, peer group.
    private static final int SCANNER_COUNT = 3;

    @Bean
    @Qualifier("auditExecutor")
    public ThreadPoolTaskExecutor auditExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(SCANNER_COUNT);
        executor.setMaxPoolSize(SCANNER_COUNT);
        executor.setQueueCapacity(64);
        executor.setThreadNamePrefix("audit-scan-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
