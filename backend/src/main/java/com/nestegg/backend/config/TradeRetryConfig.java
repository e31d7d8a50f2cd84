package com.nestegg.backend.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Duration;

@Configuration
public class TradeRetryConfig {

    @Bean
    public Retry tradeConflictRetry(SandboxProperties sandboxProperties) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(sandboxProperties.getTradeConflictRetries())
                .waitDuration(Duration.ofMillis(25))
                .retryExceptions(OptimisticLockingFailureException.class)
                .build();
        return Retry.of("trade-conflict", config);
    }
}
