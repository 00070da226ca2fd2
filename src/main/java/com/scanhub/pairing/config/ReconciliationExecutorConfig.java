package com.scanhub.pairing.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import lombok.extern.slf4j.Slf4j;

/**
 * Thread pool running legacy reconciliation tasks.
 *
 * Tasks still queued or running at shutdown are abandoned; their records stay PENDING.
 */
@Slf4j
@Configuration
public class ReconciliationExecutorConfig {

    public static final String RECONCILIATION_EXECUTOR = "reconciliationExecutor";

    @Bean(name = RECONCILIATION_EXECUTOR)
    public ThreadPoolTaskExecutor reconciliationExecutor(PairingHubProperties properties) {
        PairingHubProperties.ReconciliationConfig config = properties.getReconciliation();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCoreThreads());
        executor.setMaxPoolSize(Math.max(config.getCoreThreads(), config.getMaxThreads()));
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("legacy-sync-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        log.info("Reconciliation executor: core={}, max={}, queue={}",
                config.getCoreThreads(), config.getMaxThreads(), config.getQueueCapacity());
        return executor;
    }
}
