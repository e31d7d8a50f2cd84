package com.nestegg.backend.config;

import com.nestegg.backend.exception.MarketDataException;
import com.nestegg.backend.exception.MarketDataRateLimitException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;

@Configuration
public class MarketDataResilienceConfig {

    @Bean
    public CircuitBreaker marketDataCircuitBreaker(
            @Value("${market-data.resilience.circuit.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${market-data.resilience.circuit.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${market-data.resilience.circuit.sliding-window-size:20}") int slidingWindowSize
    ) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                .recordException(MarketDataResilienceConfig::isProviderFailure)
                .build();
        return CircuitBreaker.of("market-data", config);
    }

    // A 4xx answer (unknown ticker, bad query) is the caller's input, not provider health
    static boolean isProviderFailure(Throwable error) {
        if (!(error instanceof MarketDataException marketDataError)) {
            return true;
        }
        int status = marketDataError.getStatusCode();
        return status < 400 || status >= 500 || status == 429;
    }

    @Bean
    public RateLimiter marketDataRateLimiter(
            @Value("${market-data.resilience.rate.limit-per-second:10}") int limitPerSecond,
            @Value("${market-data.resilience.rate.timeout-ms:250}") long timeoutMs
    ) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(limitPerSecond)
                .timeoutDuration(Duration.ofMillis(timeoutMs))
                .build();
        return RateLimiter.of("market-data", config);
    }

    /**
     * Retry for history and search calls only. Current-price lookups are never retried:
     * a trade fails fast with QUOTE_UNAVAILABLE and the caller decides.
     */
    @Bean
    public Retry marketDataRetry(
            @Value("${market-data.resilience.retry.max-attempts:3}") int maxAttempts,
            @Value("${market-data.resilience.retry.base-delay-ms:300}") long baseDelayMs,
            @Value("${market-data.resilience.retry.jitter-factor:0.2}") double jitterFactor
    ) {
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(baseDelayMs),
                2.0,
                jitterFactor
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction)
                .retryExceptions(MarketDataRateLimitException.class, ResourceAccessException.class, HttpServerErrorException.class)
                .build();
        return Retry.of("market-data", config);
    }
}
