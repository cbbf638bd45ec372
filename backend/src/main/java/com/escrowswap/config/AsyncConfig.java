package com.escrowswap.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: balance-executor fans out independent per-chain balance reads.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String BALANCE_EXECUTOR = "balance-executor";

    @Bean(name = BALANCE_EXECUTOR)
    public Executor balanceExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(5);
        e.setMaxPoolSize(10);
        e.setQueueCapacity(200);
        e.setThreadNamePrefix("balance-");
        e.initialize();
        return e;
    }
}
