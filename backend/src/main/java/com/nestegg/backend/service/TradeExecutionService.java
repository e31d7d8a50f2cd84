package com.nestegg.backend.service;

import com.nestegg.backend.config.SandboxProperties;
import com.nestegg.backend.dto.TradeRequest;
import com.nestegg.backend.dto.TradeResponse;
import com.nestegg.backend.exception.BadRequestException;
import com.nestegg.backend.exception.ConflictException;
import com.nestegg.backend.exception.InvalidQuantityException;
import com.nestegg.backend.exception.QuoteUnavailableException;
import com.nestegg.backend.model.Sandbox;
import com.nestegg.backend.model.SandboxTransaction;
import com.nestegg.backend.repository.SandboxRepository;
import com.nestegg.backend.util.MoneyUtils;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Executes market BUY/SELL orders for a sandbox at the current cached price.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeExecutionService {

    private final SandboxAccessService accessService;
    private final PriceCacheService priceCacheService;
    private final SandboxLedgerService ledgerService;
    private final SandboxLockRegistry lockRegistry;
    private final Retry tradeConflictRetry;
    private final SandboxRepository sandboxRepository;
    private final PortfolioValuationService valuationService;
    private final EquitySnapshotService snapshotService;
    private final EquityHistoryService historyService;
    private final SandboxProperties sandboxProperties;
    private final Clock clock;

    public TradeResponse execute(Long sandboxId, Long callerId, TradeRequest request) {
        accessService.requireEdit(sandboxId, callerId);
        if (request.getSide() == null || !StringUtils.hasText(request.getSymbol())) {
            throw new BadRequestException("Symbol and side are required");
        }
        String symbol = PriceCacheService.normalize(request.getSymbol());
        BigDecimal price = quote(symbol);
        BigDecimal quantity = resolveQuantity(request, price);

        SandboxLedgerService.LedgerEntry entry = lockRegistry.withLock(sandboxId,
                () -> applyWithRetry(sandboxId, request, symbol, quantity, price));
        SandboxTransaction transaction = entry.transaction();
        log.info("Sandbox {} {} {} {} @ {} total={} cash={}", sandboxId, transaction.getSide(), transaction.getQuantity(),
                symbol, price, transaction.getTotal(), entry.cashBalance());

        historyService.invalidate(sandboxId);
        recordPostTradeSnapshot(sandboxId);

        return TradeResponse.builder()
                .transactionId(transaction.getId())
                .sandboxId(sandboxId)
                .symbol(symbol)
                .side(transaction.getSide())
                .price(transaction.getPrice())
                .quantity(transaction.getQuantity())
                .total(transaction.getTotal())
                .realizedPnl(transaction.getRealizedPnl())
                .newCashBalance(entry.cashBalance())
                .executedAt(transaction.getExecutedAt())
                .build();
    }

    private SandboxLedgerService.LedgerEntry applyWithRetry(Long sandboxId, TradeRequest request, String symbol,
                                                            BigDecimal quantity, BigDecimal price) {
        try {
            return Retry.decorateSupplier(tradeConflictRetry,
                    () -> ledgerService.applyFill(sandboxId, request.getSide(), symbol, quantity, price)).get();
        } catch (OptimisticLockingFailureException e) {
            log.warn("Sandbox {} still contended after {} attempts", sandboxId,
                    tradeConflictRetry.getRetryConfig().getMaxAttempts());
            throw new ConflictException("Sandbox " + sandboxId + " was modified concurrently, try again", e);
        }
    }

    BigDecimal resolveQuantity(TradeRequest request, BigDecimal price) {
        BigDecimal quantity;
        if (request.getQuantity() != null && request.getQuantity().signum() > 0) {
            quantity = MoneyUtils.quantity(request.getQuantity());
        } else if (request.getAmount() != null && request.getAmount().signum() > 0) {
            quantity = request.getAmount().divide(price, MoneyUtils.QUANTITY_SCALE, RoundingMode.DOWN);
        } else {
            throw new InvalidQuantityException("Quantity or amount must be greater than zero");
        }
        if (quantity.signum() <= 0) {
            throw new InvalidQuantityException("Order rounds to zero shares at " + price.toPlainString());
        }
        return quantity;
    }

    private BigDecimal quote(String symbol) {
        try {
            return priceCacheService.currentPrice(symbol)
                    .map(MoneyUtils::scale)
                    .filter(price -> price.signum() > 0)
                    .orElseThrow(() -> new QuoteUnavailableException(symbol));
        } catch (QuoteUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new QuoteUnavailableException(symbol, e);
        }
    }

    private void recordPostTradeSnapshot(Long sandboxId) {
        try {
            Sandbox sandbox = sandboxRepository.findById(sandboxId).orElse(null);
            if (sandbox == null) {
                return;
            }
            PortfolioValuationService.PortfolioValuation valuation = valuationService.value(sandbox);
            LocalDate today = LocalDate.ofInstant(Instant.now(clock), sandboxProperties.zoneId());
            lockRegistry.runLocked(sandboxId, () -> snapshotService.upsertSnapshot(sandboxId, today,
                    valuation.totalEquity(), valuation.cash(), valuation.holdingsValue()));
        } catch (RuntimeException e) {
            log.warn("Post-trade snapshot failed for sandbox {}: {}", sandboxId, e.getMessage());
        }
    }
}
