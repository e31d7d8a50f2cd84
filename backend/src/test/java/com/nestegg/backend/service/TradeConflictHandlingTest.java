package com.nestegg.backend.service;

import com.nestegg.backend.config.SandboxProperties;
import com.nestegg.backend.dto.TradeRequest;
import com.nestegg.backend.exception.ConflictException;
import com.nestegg.backend.model.TradeSide;
import com.nestegg.backend.repository.SandboxRepository;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.OptimisticLockingFailureException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TradeConflictHandlingTest {

    private SandboxLedgerService ledgerService;
    private EquityHistoryService historyService;
    private TradeExecutionService tradeExecutionService;

    @BeforeEach
    void setUp() {
        SandboxAccessService accessService = mock(SandboxAccessService.class);
        PriceCacheService priceCacheService = mock(PriceCacheService.class);
        ledgerService = mock(SandboxLedgerService.class);
        historyService = mock(EquityHistoryService.class);
        SandboxProperties properties = new SandboxProperties();
        properties.setLockTimeoutMillis(500);
        Retry retry = Retry.of("trade-conflict-test", RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(OptimisticLockingFailureException.class)
                .build());

        tradeExecutionService = new TradeExecutionService(accessService, priceCacheService, ledgerService,
                new SandboxLockRegistry(properties), retry, mock(SandboxRepository.class),
                mock(PortfolioValuationService.class), mock(EquitySnapshotService.class), historyService,
                properties, Clock.fixed(Instant.parse("2024-03-01T15:00:00Z"), ZoneOffset.UTC));

        when(priceCacheService.currentPrice("X")).thenReturn(Optional.of(new BigDecimal("100")));
    }

    @Test
    void persistentVersionConflictSurfacesAsConflict() {
        when(ledgerService.applyFill(eq(7L), eq(TradeSide.BUY), eq("X"), any(), any()))
                .thenThrow(new OptimisticLockingFailureException("stale sandbox version"));

        TradeRequest request = TradeRequest.builder().symbol("X").side(TradeSide.BUY).quantity(BigDecimal.ONE).build();

        assertThatThrownBy(() -> tradeExecutionService.execute(7L, 1L, request))
                .isInstanceOf(ConflictException.class)
                .hasCauseInstanceOf(OptimisticLockingFailureException.class);
        verify(ledgerService, times(3)).applyFill(eq(7L), eq(TradeSide.BUY), eq("X"), any(), any());
        verify(historyService, never()).invalidate(7L);
    }
}
