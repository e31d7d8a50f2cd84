package com.nestegg.backend.service;

import com.nestegg.backend.config.SandboxProperties;
import com.nestegg.backend.exception.InsufficientFundsException;
import com.nestegg.backend.exception.InsufficientSharesException;
import com.nestegg.backend.exception.NotFoundException;
import com.nestegg.backend.model.Sandbox;
import com.nestegg.backend.model.SandboxLot;
import com.nestegg.backend.model.SandboxTransaction;
import com.nestegg.backend.model.TradeSide;
import com.nestegg.backend.repository.EquitySnapshotRepository;
import com.nestegg.backend.repository.SandboxLotRepository;
import com.nestegg.backend.repository.SandboxRepository;
import com.nestegg.backend.repository.SandboxShareRepository;
import com.nestegg.backend.repository.SandboxTransactionRepository;
import com.nestegg.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Applies one fill to a sandbox's cash, lot and transaction log in a single database
 * transaction. Every rule check happens before the first write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SandboxLedgerService {

    private final SandboxRepository sandboxRepository;
    private final SandboxLotRepository lotRepository;
    private final SandboxTransactionRepository transactionRepository;
    private final EquitySnapshotRepository snapshotRepository;
    private final SandboxShareRepository shareRepository;
    private final SandboxProperties sandboxProperties;
    private final Clock clock;

    @Transactional
    public LedgerEntry applyFill(Long sandboxId, TradeSide side, String symbol, BigDecimal quantity, BigDecimal price) {
        Sandbox sandbox = sandboxRepository.findById(sandboxId)
                .orElseThrow(() -> new NotFoundException("Sandbox not found: " + sandboxId));
        Optional<SandboxLot> existing = lotRepository.findBySandboxIdAndSymbol(sandboxId, symbol);
        BigDecimal total = MoneyUtils.notional(price, quantity);
        Instant now = Instant.now(clock);

        BigDecimal realizedPnl = null;
        if (side == TradeSide.BUY) {
            if (sandbox.getCashBalance().compareTo(total) < 0) {
                throw new InsufficientFundsException(total, sandbox.getCashBalance());
            }
            applyBuy(sandboxId, existing, symbol, quantity, price, now);
            sandbox.setCashBalance(MoneyUtils.subtract(sandbox.getCashBalance(), total));
        } else {
            BigDecimal owned = existing.map(SandboxLot::getQuantity).orElse(BigDecimal.ZERO);
            if (owned.compareTo(quantity) < 0) {
                throw new InsufficientSharesException(symbol, quantity, owned);
            }
            SandboxLot lot = existing.get();
            realizedPnl = MoneyUtils.scale(quantity.multiply(price.subtract(lot.getAverageCost())));
            applySell(lot, quantity, now);
            sandbox.setCashBalance(MoneyUtils.add(sandbox.getCashBalance(), total));
            sandbox.setRealizedPnl(MoneyUtils.add(sandbox.getRealizedPnl(), realizedPnl));
        }
        sandbox.setUpdatedAt(now);
        sandboxRepository.save(sandbox);

        SandboxTransaction transaction = transactionRepository.save(SandboxTransaction.builder()
                .sandboxId(sandboxId)
                .symbol(symbol)
                .side(side)
                .quantity(quantity)
                .price(price)
                .total(total)
                .realizedPnl(realizedPnl)
                .executedAt(now)
                .build());
        return new LedgerEntry(transaction, sandbox.getCashBalance());
    }

    /**
     * Removes a sandbox with its transactions, lots, snapshots and share grants.
     */
    @Transactional
    public void deleteCascade(Long sandboxId) {
        int transactions = transactionRepository.deleteBySandboxId(sandboxId);
        int lots = lotRepository.deleteBySandboxId(sandboxId);
        int snapshots = snapshotRepository.deleteBySandboxId(sandboxId);
        int shares = shareRepository.deleteBySandboxId(sandboxId);
        sandboxRepository.deleteById(sandboxId);
        log.info("Deleted sandbox {} (transactions={}, lots={}, snapshots={}, shares={})",
                sandboxId, transactions, lots, snapshots, shares);
    }

    private void applyBuy(Long sandboxId, Optional<SandboxLot> existing, String symbol,
                          BigDecimal quantity, BigDecimal price, Instant now) {
        SandboxLot lot = existing.orElseGet(() -> SandboxLot.builder()
                .sandboxId(sandboxId)
                .symbol(symbol)
                .quantity(BigDecimal.ZERO)
                .averageCost(price)
                .build());
        if (lot.getQuantity().signum() > 0) {
            lot.setAverageCost(MoneyUtils.weightedAverage(lot.getQuantity(), lot.getAverageCost(), quantity, price));
        } else {
            lot.setAverageCost(price.setScale(MoneyUtils.COST_SCALE, RoundingMode.HALF_UP));
        }
        lot.setQuantity(MoneyUtils.quantity(lot.getQuantity().add(quantity)));
        lot.setUpdatedAt(now);
        lotRepository.save(lot);
    }

    private void applySell(SandboxLot lot, BigDecimal quantity, Instant now) {
        BigDecimal remaining = MoneyUtils.quantity(lot.getQuantity().subtract(quantity));
        if (remaining.compareTo(sandboxProperties.getLotEpsilon()) <= 0) {
            log.debug("Closing lot {} in sandbox {}", lot.getSymbol(), lot.getSandboxId());
            lotRepository.delete(lot);
            return;
        }
        lot.setQuantity(remaining);
        lot.setUpdatedAt(now);
        lotRepository.save(lot);
    }

    public record LedgerEntry(SandboxTransaction transaction, BigDecimal cashBalance) {
    }
}
