package com.nestegg.backend.service;

import com.nestegg.backend.dto.EquityPointDTO;
import com.nestegg.backend.dto.PortfolioResponse;
import com.nestegg.backend.dto.TransactionDTO;
import com.nestegg.backend.exception.MarketDataException;
import com.nestegg.backend.exception.PermissionDeniedException;
import com.nestegg.backend.model.AccessLevel;
import com.nestegg.backend.model.Sandbox;
import com.nestegg.backend.model.SandboxLot;
import com.nestegg.backend.model.SandboxTransaction;
import com.nestegg.backend.model.TradeSide;
import com.nestegg.backend.repository.EquitySnapshotRepository;
import com.nestegg.backend.repository.SandboxLotRepository;
import com.nestegg.backend.repository.SandboxRepository;
import com.nestegg.backend.repository.SandboxShareRepository;
import com.nestegg.backend.repository.SandboxTransactionRepository;
import com.nestegg.backend.service.marketdata.MarketDataClient;
import com.nestegg.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@SpringBootTest
class SandboxPortfolioScenarioTest {

    private static final Instant DAY0_OPEN = Instant.parse("2024-01-08T14:30:00Z");
    private static final LocalDate DAY0 = LocalDate.of(2024, 1, 8);

    @TestConfiguration
    static class ClockOverride {
        @Bean
        @Primary
        MutableClock scenarioClock() {
            return new MutableClock(DAY0_OPEN);
        }
    }

    @Autowired
    private SandboxService sandboxService;

    @Autowired
    private PriceCacheService priceCacheService;

    @Autowired
    private EquityCurveCache equityCurveCache;

    @Autowired
    private Clock clock;

    @Autowired
    private SandboxRepository sandboxRepository;

    @Autowired
    private SandboxLotRepository lotRepository;

    @Autowired
    private SandboxTransactionRepository transactionRepository;

    @Autowired
    private EquitySnapshotRepository snapshotRepository;

    @Autowired
    private SandboxShareRepository shareRepository;

    @MockBean
    private MarketDataClient marketDataClient;

    private final Long ownerId = 7L;
    private Long sandboxId;

    @BeforeEach
    void setup() {
        transactionRepository.deleteAll();
        lotRepository.deleteAll();
        snapshotRepository.deleteAll();
        shareRepository.deleteAll();
        sandboxRepository.deleteAll();
        priceCacheService.clear();
        ((MutableClock) clock).set(DAY0_OPEN.plus(Duration.ofDays(5)));

        Sandbox sandbox = sandboxRepository.save(Sandbox.builder()
                .userId(ownerId)
                .name("Scenario")
                .initialBalance(new BigDecimal("10000.0000"))
                .cashBalance(new BigDecimal("9000.0000"))
                .realizedPnl(BigDecimal.ZERO)
                .createdAt(DAY0_OPEN)
                .updatedAt(DAY0_OPEN)
                .build());
        sandboxId = sandbox.getId();
        equityCurveCache.invalidate(sandboxId);
        lotRepository.save(SandboxLot.builder()
                .sandboxId(sandboxId)
                .symbol("X")
                .quantity(new BigDecimal("10"))
                .averageCost(new BigDecimal("100"))
                .updatedAt(DAY0_OPEN)
                .build());
        transactionRepository.save(SandboxTransaction.builder()
                .sandboxId(sandboxId)
                .symbol("X")
                .side(TradeSide.BUY)
                .quantity(new BigDecimal("10"))
                .price(new BigDecimal("100"))
                .total(new BigDecimal("1000.0000"))
                .executedAt(DAY0_OPEN.plusSeconds(60))
                .build());

        NavigableMap<LocalDate, BigDecimal> closes = new TreeMap<>();
        closes.put(DAY0, new BigDecimal("100"));
        closes.put(DAY0.plusDays(5), new BigDecimal("110"));
        when(marketDataClient.historicalDailyCloses(anyCollection(), eq(DAY0))).thenReturn(Map.of("X", closes));
        when(marketDataClient.currentPrice("X")).thenReturn(Optional.of(new BigDecimal("110")));
    }

    @Test
    void priceRiseShowsInValuationAndCurve() {
        PortfolioResponse portfolio = sandboxService.getPortfolio(ownerId, sandboxId);

        assertThat(portfolio.getHoldingsValue()).isEqualByComparingTo("1100");
        assertThat(portfolio.getTotalEquity()).isEqualByComparingTo("10100");
        assertThat(portfolio.getPermission()).isEqualTo(AccessLevel.OWNER);
        assertThat(portfolio.getHistoryError()).isNull();
        assertThat(portfolio.getLots()).singleElement().satisfies(lot -> {
            assertThat(lot.getGainLoss()).isEqualByComparingTo("100");
            assertThat(lot.getGainLossPercent()).isEqualByComparingTo("10");
            assertThat(lot.isPriceStale()).isFalse();
        });
        List<EquityPointDTO> curve = portfolio.getEquityCurve();
        assertThat(curve).hasSize(6);
        assertThat(curve.get(0).getDate()).isEqualTo(DAY0);
        assertThat(curve.get(0).getValue()).isEqualByComparingTo("10000");
        assertThat(curve.get(5).getValue()).isEqualByComparingTo("10100");
        assertThat(snapshotRepository.countBySandboxId(sandboxId)).isEqualTo(6);
    }

    @Test
    void secondViewUsesStoredSnapshots() {
        sandboxService.getPortfolio(ownerId, sandboxId);
        equityCurveCache.invalidate(sandboxId);
        when(marketDataClient.historicalDailyCloses(anyCollection(), eq(DAY0)))
                .thenThrow(new IllegalStateException("history must not be refetched"));

        PortfolioResponse again = sandboxService.getPortfolio(ownerId, sandboxId);

        assertThat(again.getHistoryError()).isNull();
        assertThat(again.getEquityCurve()).hasSize(6);
    }

    @Test
    void unavailableLivePriceFallsBackToAverageCost() {
        when(marketDataClient.currentPrice("X")).thenReturn(Optional.empty());

        PortfolioResponse portfolio = sandboxService.getPortfolio(ownerId, sandboxId);

        assertThat(portfolio.getTotalEquity()).isEqualByComparingTo("10000");
        assertThat(portfolio.getLots().get(0).isPriceStale()).isTrue();
    }

    @Test
    void historyOutageStillReturnsPortfolio() {
        when(marketDataClient.historicalDailyCloses(anyCollection(), eq(DAY0)))
                .thenThrow(new MarketDataException("provider down"));

        PortfolioResponse portfolio = sandboxService.getPortfolio(ownerId, sandboxId);

        assertThat(portfolio.getHistoryError()).isNotBlank();
        assertThat(portfolio.getEquityCurve()).hasSize(2);
        assertThat(portfolio.getEquityCurve().get(1).getValue()).isEqualByComparingTo("10100");
        assertThat(portfolio.getTotalEquity()).isEqualByComparingTo("10100");
    }

    @Test
    void strangersCannotView() {
        assertThatThrownBy(() -> sandboxService.getPortfolio(999L, sandboxId))
                .isInstanceOf(PermissionDeniedException.class);
    }

    @Test
    void transactionsAreListedNewestFirst() {
        transactionRepository.save(SandboxTransaction.builder()
                .sandboxId(sandboxId)
                .symbol("X")
                .side(TradeSide.SELL)
                .quantity(new BigDecimal("1"))
                .price(new BigDecimal("105"))
                .total(new BigDecimal("105.0000"))
                .executedAt(DAY0_OPEN.plus(Duration.ofDays(2)))
                .build());

        List<TransactionDTO> log = sandboxService.getTransactions(ownerId, sandboxId);

        assertThat(log).extracting(TransactionDTO::getSide).containsExactly(TradeSide.SELL, TradeSide.BUY);
    }

    @Test
    void deleteCascadesEverything() {
        sandboxService.getPortfolio(ownerId, sandboxId);

        sandboxService.deleteSandbox(ownerId, sandboxId);

        assertThat(sandboxRepository.findById(sandboxId)).isEmpty();
        assertThat(lotRepository.findBySandboxIdOrderBySymbolAsc(sandboxId)).isEmpty();
        assertThat(transactionRepository.findBySandboxIdOrderByExecutedAtAscIdAsc(sandboxId)).isEmpty();
        assertThat(snapshotRepository.countBySandboxId(sandboxId)).isZero();
    }
}
