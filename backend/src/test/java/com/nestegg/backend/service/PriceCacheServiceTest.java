package com.nestegg.backend.service;

import com.nestegg.backend.config.SandboxProperties;
import com.nestegg.backend.exception.MarketDataException;
import com.nestegg.backend.service.marketdata.MarketDataClient;
import com.nestegg.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PriceCacheServiceTest {

    private MarketDataClient marketDataClient;
    private MutableClock clock;
    private PriceCacheService priceCacheService;

    @BeforeEach
    void setUp() {
        marketDataClient = mock(MarketDataClient.class);
        clock = new MutableClock(Instant.parse("2024-03-01T15:00:00Z"));
        priceCacheService = new PriceCacheService(marketDataClient, new SandboxProperties(), clock);
    }

    @Test
    void freshEntryIsServedWithoutRefetch() {
        when(marketDataClient.currentPrice("AAPL")).thenReturn(Optional.of(new BigDecimal("180.0000")));

        priceCacheService.currentPrice("aapl");
        clock.advance(Duration.ofSeconds(299));
        Optional<BigDecimal> second = priceCacheService.currentPrice("AAPL");

        assertThat(second).contains(new BigDecimal("180.0000"));
        verify(marketDataClient, times(1)).currentPrice("AAPL");
    }

    @Test
    void expiredEntryIsRefetched() {
        when(marketDataClient.currentPrice("AAPL"))
                .thenReturn(Optional.of(new BigDecimal("180.0000")))
                .thenReturn(Optional.of(new BigDecimal("181.0000")));

        priceCacheService.currentPrice("AAPL");
        clock.advance(Duration.ofSeconds(300));

        assertThat(priceCacheService.currentPrice("AAPL")).contains(new BigDecimal("181.0000"));
        verify(marketDataClient, times(2)).currentPrice("AAPL");
    }

    @Test
    void invalidateForcesRefetch() {
        when(marketDataClient.currentPrice("MSFT")).thenReturn(Optional.of(new BigDecimal("400.0000")));

        priceCacheService.currentPrice("MSFT");
        priceCacheService.invalidate("MSFT");
        priceCacheService.currentPrice("MSFT");

        verify(marketDataClient, times(2)).currentPrice("MSFT");
    }

    @Test
    void batchFallsBackPerSymbol() {
        when(marketDataClient.currentPrice("AAPL")).thenReturn(Optional.of(new BigDecimal("180.0000")));
        when(marketDataClient.currentPrice("GONE")).thenReturn(Optional.empty());
        when(marketDataClient.currentPrice("BOOM")).thenThrow(new MarketDataException("provider down"));
        Map<String, BigDecimal> fallbacks = new LinkedHashMap<>();
        fallbacks.put("AAPL", new BigDecimal("150"));
        fallbacks.put("GONE", new BigDecimal("12.5"));
        fallbacks.put("BOOM", new BigDecimal("7"));

        Map<String, PriceCacheService.LivePrice> prices = priceCacheService.currentPrices(fallbacks);

        assertThat(prices.get("AAPL")).isEqualTo(new PriceCacheService.LivePrice(new BigDecimal("180.0000"), false));
        assertThat(prices.get("GONE")).isEqualTo(new PriceCacheService.LivePrice(new BigDecimal("12.5"), true));
        assertThat(prices.get("BOOM")).isEqualTo(new PriceCacheService.LivePrice(new BigDecimal("7"), true));
    }

    @Test
    void historicalClosesAreGapFilledAndCached() {
        LocalDate from = LocalDate.of(2024, 3, 1);
        LocalDate to = LocalDate.of(2024, 3, 4);
        NavigableMap<LocalDate, BigDecimal> raw = new TreeMap<>();
        raw.put(from, new BigDecimal("10"));
        raw.put(to, new BigDecimal("12"));
        when(marketDataClient.historicalDailyCloses(anyCollection(), any())).thenReturn(Map.of("X", raw));

        Map<String, PriceSeries> first = priceCacheService.historicalCloses(List.of("X"), from, to);
        Map<String, PriceSeries> second = priceCacheService.historicalCloses(List.of("X"), from, to);

        assertThat(first.get("X").priceOn(LocalDate.of(2024, 3, 3))).contains(new BigDecimal("10"));
        assertThat(second.get("X")).isSameAs(first.get("X"));
        verify(marketDataClient, times(1)).historicalDailyCloses(anyCollection(), any());
    }

    @Test
    void historyFailurePropagates() {
        when(marketDataClient.historicalDailyCloses(anyCollection(), any()))
                .thenThrow(new MarketDataException("timeout"));

        assertThatThrownBy(() -> priceCacheService.historicalCloses(List.of("X"),
                LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 2)))
                .isInstanceOf(MarketDataException.class);
    }
}
