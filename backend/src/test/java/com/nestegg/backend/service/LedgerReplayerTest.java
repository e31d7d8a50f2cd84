package com.nestegg.backend.service;

import com.nestegg.backend.model.SandboxTransaction;
import com.nestegg.backend.model.TradeSide;
import com.nestegg.backend.util.MoneyUtils;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;

class LedgerReplayerTest {

    private static final LocalDate DAY0 = LocalDate.of(2024, 1, 8);

    private final LedgerReplayer replayer = new LedgerReplayer(ZoneOffset.UTC, new BigDecimal("0.000001"));

    @Test
    void buyOnDayZeroThenPriceRise() {
        List<SandboxTransaction> log = List.of(
                tx(1L, "X", TradeSide.BUY, "10", "100", DAY0.atTime(14, 30).toInstant(ZoneOffset.UTC)));
        NavigableMap<LocalDate, BigDecimal> closes = new TreeMap<>();
        closes.put(DAY0, new BigDecimal("100"));
        closes.put(DAY0.plusDays(5), new BigDecimal("110"));
        Map<String, PriceSeries> series = Map.of("X", PriceSeries.gapFilled(closes, DAY0, DAY0.plusDays(5)));

        List<DailyEquity> days = replayer.replay(new BigDecimal("10000"), log, DAY0, DAY0.plusDays(5), series);

        assertThat(days).hasSize(6);
        assertThat(days.get(0).cash()).isEqualByComparingTo("9000");
        assertThat(days.get(0).totalEquity()).isEqualByComparingTo("10000");
        assertThat(days.get(3).totalEquity()).isEqualByComparingTo("10000");
        assertThat(days.get(5).holdingsValue()).isEqualByComparingTo("1100");
        assertThat(days.get(5).totalEquity()).isEqualByComparingTo("10100");
    }

    @Test
    void sellOnLaterDayRestoresCashAndClosesHolding() {
        List<SandboxTransaction> log = List.of(
                tx(1L, "X", TradeSide.BUY, "10", "100", DAY0.atStartOfDay().toInstant(ZoneOffset.UTC)),
                tx(2L, "X", TradeSide.SELL, "10", "120", DAY0.plusDays(2).atTime(10, 0).toInstant(ZoneOffset.UTC)));
        NavigableMap<LocalDate, BigDecimal> closes = new TreeMap<>();
        closes.put(DAY0, new BigDecimal("100"));
        closes.put(DAY0.plusDays(2), new BigDecimal("130"));
        Map<String, PriceSeries> series = Map.of("X", PriceSeries.gapFilled(closes, DAY0, DAY0.plusDays(3)));

        List<DailyEquity> days = replayer.replay(new BigDecimal("10000"), log, DAY0, DAY0.plusDays(3), series);

        assertThat(days.get(2).cash()).isEqualByComparingTo("10200");
        assertThat(days.get(2).holdingsValue()).isEqualByComparingTo("0");
        assertThat(days.get(3).totalEquity()).isEqualByComparingTo("10200");
    }

    @Test
    void symbolWithoutDataContributesZero() {
        List<SandboxTransaction> log = List.of(
                tx(1L, "DELISTED", TradeSide.BUY, "5", "20", DAY0.atTime(9, 0).toInstant(ZoneOffset.UTC)));
        Map<String, PriceSeries> series = Map.of("DELISTED", PriceSeries.gapFilled(new TreeMap<>(), DAY0, DAY0));

        List<DailyEquity> days = replayer.replay(new BigDecimal("1000"), log, DAY0, DAY0, series);

        assertThat(days.get(0).cash()).isEqualByComparingTo("900");
        assertThat(days.get(0).totalEquity()).isEqualByComparingTo("900");
    }

    @Test
    void sameTimestampKeepsLogOrder() {
        Instant at = DAY0.atTime(12, 0).toInstant(ZoneOffset.UTC);
        List<SandboxTransaction> log = List.of(
                tx(1L, "X", TradeSide.BUY, "1", "50", at),
                tx(2L, "X", TradeSide.SELL, "1", "50", at));

        List<DailyEquity> days = replayer.replay(new BigDecimal("100"), log, DAY0, DAY0, Map.of());

        assertThat(days.get(0).cash()).isEqualByComparingTo("100");
    }

    @Test
    void replayIsDeterministic() {
        List<SandboxTransaction> log = List.of(
                tx(1L, "A", TradeSide.BUY, "3.333333", "33.3333", DAY0.atTime(10, 0).toInstant(ZoneOffset.UTC)),
                tx(2L, "B", TradeSide.BUY, "7", "12.01", DAY0.plusDays(1).atTime(10, 0).toInstant(ZoneOffset.UTC)),
                tx(3L, "A", TradeSide.SELL, "1.5", "35", DAY0.plusDays(2).atTime(10, 0).toInstant(ZoneOffset.UTC)));
        NavigableMap<LocalDate, BigDecimal> a = new TreeMap<>(Map.of(DAY0, new BigDecimal("33"), DAY0.plusDays(2), new BigDecimal("36")));
        NavigableMap<LocalDate, BigDecimal> b = new TreeMap<>(Map.of(DAY0.plusDays(1), new BigDecimal("12.5")));
        Map<String, PriceSeries> series = Map.of(
                "A", PriceSeries.gapFilled(a, DAY0, DAY0.plusDays(4)),
                "B", PriceSeries.gapFilled(b, DAY0, DAY0.plusDays(4)));

        List<DailyEquity> first = replayer.replay(new BigDecimal("5000"), log, DAY0, DAY0.plusDays(4), series);
        List<DailyEquity> second = replayer.replay(new BigDecimal("5000"), log, DAY0, DAY0.plusDays(4), series);

        assertThat(first).isEqualTo(second);
    }

    private SandboxTransaction tx(Long id, String symbol, TradeSide side, String qty, String price, Instant at) {
        BigDecimal quantity = new BigDecimal(qty);
        BigDecimal px = new BigDecimal(price);
        return SandboxTransaction.builder()
                .id(id)
                .sandboxId(1L)
                .symbol(symbol)
                .side(side)
                .quantity(quantity)
                .price(px)
                .total(MoneyUtils.notional(px, quantity))
                .executedAt(at)
                .build();
    }
}
