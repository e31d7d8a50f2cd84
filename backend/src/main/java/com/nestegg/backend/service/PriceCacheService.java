package com.nestegg.backend.service;

import com.nestegg.backend.config.SandboxProperties;
import com.nestegg.backend.exception.MarketDataException;
import com.nestegg.backend.service.marketdata.MarketDataClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-through, process-local cache over {@link MarketDataClient}. Entries expire after
 * {@code sandbox.quote-ttl-seconds}; concurrent misses on one symbol may both fetch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceCacheService {

    private final MarketDataClient marketDataClient;
    private final SandboxProperties sandboxProperties;
    private final Clock clock;

    private final Map<String, CachedPrice> quotes = new ConcurrentHashMap<>();
    private final Map<String, CachedSeries> histories = new ConcurrentHashMap<>();

    public Optional<BigDecimal> currentPrice(String symbol) {
        return currentQuote(symbol).map(CachedPrice::price);
    }

    public Optional<CachedPrice> currentQuote(String symbol) {
        if (!StringUtils.hasText(symbol)) {
            return Optional.empty();
        }
        String key = normalize(symbol);
        Instant now = Instant.now(clock);
        CachedPrice cached = quotes.get(key);
        if (cached != null && isFresh(cached.fetchedAt(), now)) {
            return Optional.of(cached);
        }
        Optional<BigDecimal> fetched = marketDataClient.currentPrice(key);
        if (fetched.isEmpty()) {
            return Optional.empty();
        }
        CachedPrice entry = new CachedPrice(fetched.get(), now);
        quotes.put(key, entry);
        return Optional.of(entry);
    }

    /**
     * Prices every symbol in {@code fallbacks}. A symbol whose price cannot be obtained
     * gets its fallback value and is flagged stale; the batch itself never fails.
     */
    public Map<String, LivePrice> currentPrices(Map<String, BigDecimal> fallbacks) {
        Map<String, LivePrice> prices = new LinkedHashMap<>();
        fallbacks.forEach((symbol, fallback) -> {
            Optional<BigDecimal> price;
            try {
                price = currentPrice(symbol);
            } catch (RuntimeException e) {
                log.warn("Price lookup for {} failed, using fallback {}: {}", symbol, fallback, e.getMessage());
                price = Optional.empty();
            }
            if (price.isPresent()) {
                prices.put(symbol, new LivePrice(price.get(), false));
            } else {
                log.warn("No live price for {}, valuing at fallback {}", symbol, fallback);
                prices.put(symbol, new LivePrice(fallback, true));
            }
        });
        return prices;
    }

    /**
     * Gap-filled daily closes over {@code [from, to]} for each symbol.
     *
     * @throws MarketDataException when the provider cannot serve the uncached symbols
     */
    public Map<String, PriceSeries> historicalCloses(Collection<String> symbols, LocalDate from, LocalDate to) {
        Instant now = Instant.now(clock);
        Map<String, PriceSeries> result = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (String symbol : symbols) {
            String key = normalize(symbol);
            CachedSeries cached = histories.get(key);
            if (cached != null && isFresh(cached.fetchedAt(), now) && cached.series().covers(from, to)) {
                result.put(key, cached.series());
            } else {
                missing.add(key);
            }
        }
        if (missing.isEmpty()) {
            return result;
        }
        Map<String, NavigableMap<LocalDate, BigDecimal>> fetched = marketDataClient.historicalDailyCloses(missing, from);
        for (String key : missing) {
            PriceSeries series = PriceSeries.gapFilled(fetched.get(key), from, to);
            if (series.isEmpty()) {
                log.warn("No historical closes for {} from {}", key, from);
            }
            histories.put(key, new CachedSeries(series, now));
            result.put(key, series);
        }
        return result;
    }

    public void invalidate(String symbol) {
        if (StringUtils.hasText(symbol)) {
            quotes.remove(normalize(symbol));
            histories.remove(normalize(symbol));
        }
    }

    public void clear() {
        quotes.clear();
        histories.clear();
    }

    private boolean isFresh(Instant fetchedAt, Instant now) {
        return Duration.between(fetchedAt, now).getSeconds() < sandboxProperties.getQuoteTtlSeconds();
    }

    static String normalize(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    public record CachedPrice(BigDecimal price, Instant fetchedAt) {
    }

    public record LivePrice(BigDecimal price, boolean stale) {
    }

    private record CachedSeries(PriceSeries series, Instant fetchedAt) {
    }
}
