package com.nestegg.backend.service.marketdata;

import com.nestegg.backend.exception.MarketDataException;
import com.nestegg.backend.exception.MarketDataRateLimitException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.List;
import java.util.function.Supplier;

/**
 * GET-only HTTP access to the market data provider, wrapped in rate limiter, circuit
 * breaker and (optionally) retry. Timeouts come from the RestTemplate request factory.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketDataHttpClient {

    static final String USER_AGENT = "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    private final RestTemplate marketDataRestTemplate;
    private final CircuitBreaker marketDataCircuitBreaker;
    private final RateLimiter marketDataRateLimiter;
    private final Retry marketDataRetry;
    private final MeterRegistry meterRegistry;

    /**
     * Single attempt. Used for current prices, which must not be silently retried.
     * {@code url} must already be encoded.
     */
    public String get(String url, String operation) {
        return execute(url, operation, false);
    }

    public String getWithRetry(String url, String operation) {
        return execute(url, operation, true);
    }

    private String execute(String url, String operation, boolean retryable) {
        Timer.Sample sample = Timer.start(meterRegistry);
        boolean success = false;
        try {
            Supplier<String> decorated = () -> doRequest(url);
            if (retryable) {
                decorated = Retry.decorateSupplier(marketDataRetry, decorated);
            }
            decorated = CircuitBreaker.decorateSupplier(marketDataCircuitBreaker, decorated);
            decorated = RateLimiter.decorateSupplier(marketDataRateLimiter, decorated);
            String response = decorated.get();
            success = true;
            return response;
        } catch (CallNotPermittedException e) {
            log.warn("Market data circuit open, skipping {} {}", operation, url);
            throw new MarketDataException("Market data circuit breaker open", e);
        } catch (RequestNotPermitted e) {
            log.warn("Market data local rate limit hit for {} {}", operation, url);
            throw new MarketDataRateLimitException("Market data request rate exceeded");
        } catch (MarketDataException e) {
            log.warn("Market data request failed operation={} url={} status={} message={}",
                    operation, url, e.getStatusCode(), e.getMessage());
            throw e;
        } catch (HttpServerErrorException e) {
            log.warn("Market data server error operation={} url={} status={}", operation, url, e.getStatusCode().value());
            throw new MarketDataException("Market data server error (" + e.getStatusCode().value() + ")",
                    e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            log.warn("Market data network error operation={} url={} message={}", operation, url, e.getMessage());
            throw new MarketDataException("Market data provider unreachable", e);
        } finally {
            sample.stop(Timer.builder("market_data_call_latency")
                    .tag("operation", operation)
                    .tag("status", success ? "success" : "error")
                    .register(meterRegistry));
        }
    }

    private String doRequest(String url) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));
            ResponseEntity<String> response = marketDataRestTemplate.exchange(URI.create(url), HttpMethod.GET,
                    new HttpEntity<>(headers), String.class);
            return response.getBody();
        } catch (HttpClientErrorException.TooManyRequests e) {
            throw new MarketDataRateLimitException("Market data provider rate limit");
        } catch (HttpClientErrorException e) {
            throw new MarketDataException("Market data error (" + e.getStatusCode().value() + ")",
                    e.getStatusCode().value(), e);
        }
    }
}
