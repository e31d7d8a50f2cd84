package com.nestegg.backend.service;

import com.nestegg.backend.config.SandboxProperties;
import com.nestegg.backend.dto.CreateSandboxRequest;
import com.nestegg.backend.dto.EquityPointDTO;
import com.nestegg.backend.dto.LotDTO;
import com.nestegg.backend.dto.PortfolioResponse;
import com.nestegg.backend.dto.SandboxSummaryDTO;
import com.nestegg.backend.dto.TransactionDTO;
import com.nestegg.backend.exception.BadRequestException;
import com.nestegg.backend.model.AccessLevel;
import com.nestegg.backend.model.Sandbox;
import com.nestegg.backend.model.SandboxLot;
import com.nestegg.backend.model.SandboxShare;
import com.nestegg.backend.repository.SandboxRepository;
import com.nestegg.backend.repository.SandboxShareRepository;
import com.nestegg.backend.repository.SandboxTransactionRepository;
import com.nestegg.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class SandboxService {

    private final SandboxRepository sandboxRepository;
    private final SandboxShareRepository shareRepository;
    private final SandboxTransactionRepository transactionRepository;
    private final SandboxAccessService accessService;
    private final SandboxLedgerService ledgerService;
    private final SandboxLockRegistry lockRegistry;
    private final PortfolioValuationService valuationService;
    private final EquitySnapshotService snapshotService;
    private final EquityHistoryService historyService;
    private final SandboxProperties sandboxProperties;
    private final Clock clock;

    public List<SandboxSummaryDTO> listSandboxes(Long userId) {
        List<Sandbox> sandboxes = sandboxRepository.findByUserIdOrderByCreatedAtDesc(userId);
        Map<Long, PortfolioValuationService.PortfolioValuation> valuations = valuationService.valueAll(sandboxes);
        return sandboxes.stream()
                .map(sandbox -> toSummary(sandbox, valuations.get(sandbox.getId()), AccessLevel.OWNER))
                .collect(Collectors.toList());
    }

    public List<SandboxSummaryDTO> listShared(Long userId) {
        List<SandboxShare> shares = shareRepository.findBySharedWithIdOrderByCreatedAtDesc(userId);
        if (shares.isEmpty()) {
            return List.of();
        }
        Map<Long, Sandbox> sandboxes = sandboxRepository.findByIdIn(
                        shares.stream().map(SandboxShare::getSandboxId).collect(Collectors.toList()))
                .stream()
                .collect(Collectors.toMap(Sandbox::getId, Function.identity()));
        Map<Long, PortfolioValuationService.PortfolioValuation> valuations = valuationService.valueAll(sandboxes.values());
        List<SandboxSummaryDTO> summaries = new ArrayList<>();
        for (SandboxShare share : shares) {
            Sandbox sandbox = sandboxes.get(share.getSandboxId());
            if (sandbox != null) {
                summaries.add(toSummary(sandbox, valuations.get(sandbox.getId()), AccessLevel.from(share.getPermission())));
            }
        }
        return summaries;
    }

    @Transactional
    public SandboxSummaryDTO createSandbox(Long userId, CreateSandboxRequest request) {
        String name = request.getName() == null ? "" : request.getName().trim();
        if (name.isEmpty()) {
            throw new BadRequestException("Name is required");
        }
        BigDecimal initialCash = request.getInitialCash() != null
                ? request.getInitialCash()
                : sandboxProperties.getDefaultInitialCash();
        if (initialCash.signum() <= 0) {
            throw new BadRequestException("Initial cash must be greater than zero");
        }
        Instant now = Instant.now(clock);
        Sandbox sandbox = sandboxRepository.save(Sandbox.builder()
                .userId(userId)
                .name(name)
                .initialBalance(MoneyUtils.scale(initialCash))
                .cashBalance(MoneyUtils.scale(initialCash))
                .realizedPnl(MoneyUtils.ZERO)
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.info("User {} created sandbox {} '{}' with {}", userId, sandbox.getId(), name, sandbox.getInitialBalance());
        return toSummary(sandbox, null, AccessLevel.OWNER);
    }

    public void deleteSandbox(Long userId, Long sandboxId) {
        accessService.requireOwner(sandboxId, userId);
        lockRegistry.runLocked(sandboxId, () -> ledgerService.deleteCascade(sandboxId));
        historyService.invalidate(sandboxId);
    }

    public PortfolioResponse getPortfolio(Long callerId, Long sandboxId) {
        SandboxAccessService.SandboxAccess access = accessService.requireWatch(sandboxId, callerId);
        Sandbox sandbox = access.sandbox();
        PortfolioValuationService.PortfolioValuation valuation = valuationService.value(sandbox);
        EquityHistoryService.EquityCurve curve = historyService.equityCurve(sandbox, valuation.totalEquity());

        LocalDate today = LocalDate.ofInstant(Instant.now(clock), sandboxProperties.zoneId());
        recordViewSnapshot(sandboxId, today, valuation);
        List<EquityPointDTO> points = curve.historyError() == null
                ? withLivePoint(curve.points(), today, valuation.totalEquity())
                : curve.points();

        return PortfolioResponse.builder()
                .sandboxId(sandbox.getId())
                .name(sandbox.getName())
                .lots(valuation.lots().stream().map(this::toLot).collect(Collectors.toList()))
                .cash(valuation.cash())
                .initialCash(MoneyUtils.scale(sandbox.getInitialBalance()))
                .holdingsValue(valuation.holdingsValue())
                .totalEquity(valuation.totalEquity())
                .realizedPnl(MoneyUtils.scale(sandbox.getRealizedPnl()))
                .equityCurve(points)
                .historyError(curve.historyError())
                .permission(access.level())
                .build();
    }

    @Transactional(readOnly = true)
    public List<TransactionDTO> getTransactions(Long callerId, Long sandboxId) {
        accessService.requireWatch(sandboxId, callerId);
        return transactionRepository.findBySandboxIdOrderByExecutedAtDescIdDesc(sandboxId).stream()
                .map(tx -> TransactionDTO.builder()
                        .id(tx.getId())
                        .symbol(tx.getSymbol())
                        .side(tx.getSide())
                        .quantity(tx.getQuantity())
                        .price(tx.getPrice())
                        .total(tx.getTotal())
                        .realizedPnl(tx.getRealizedPnl())
                        .executedAt(tx.getExecutedAt())
                        .build())
                .collect(Collectors.toList());
    }

    private void recordViewSnapshot(Long sandboxId, LocalDate today, PortfolioValuationService.PortfolioValuation valuation) {
        try {
            lockRegistry.runLocked(sandboxId, () -> snapshotService.upsertSnapshot(sandboxId, today,
                    valuation.totalEquity(), valuation.cash(), valuation.holdingsValue()));
        } catch (RuntimeException e) {
            log.warn("Daily snapshot failed for sandbox {}: {}", sandboxId, e.getMessage());
        }
    }

    // Today's point always reflects the live valuation, not the last stored close
    private List<EquityPointDTO> withLivePoint(List<EquityPointDTO> points, LocalDate today, BigDecimal totalEquity) {
        List<EquityPointDTO> merged = new ArrayList<>(points);
        EquityPointDTO live = historyService.point(today, totalEquity);
        if (!merged.isEmpty() && today.equals(merged.get(merged.size() - 1).getDate())) {
            merged.set(merged.size() - 1, live);
        } else {
            merged.add(live);
        }
        return merged;
    }

    private LotDTO toLot(PortfolioValuationService.LotValuation valuation) {
        SandboxLot lot = valuation.lot();
        BigDecimal costBasis = MoneyUtils.notional(lot.getAverageCost(), lot.getQuantity());
        return LotDTO.builder()
                .symbol(lot.getSymbol())
                .quantity(lot.getQuantity())
                .averageCost(lot.getAverageCost())
                .currentPrice(valuation.price())
                .currentValue(valuation.value())
                .gainLoss(MoneyUtils.subtract(valuation.value(), costBasis))
                .gainLossPercent(MoneyUtils.percentChange(lot.getAverageCost(), valuation.price()))
                .priceStale(valuation.stale())
                .build();
    }

    private SandboxSummaryDTO toSummary(Sandbox sandbox, PortfolioValuationService.PortfolioValuation valuation,
                                        AccessLevel permission) {
        BigDecimal cash = MoneyUtils.scale(sandbox.getCashBalance());
        return SandboxSummaryDTO.builder()
                .id(sandbox.getId())
                .name(sandbox.getName())
                .cash(cash)
                .initialCash(MoneyUtils.scale(sandbox.getInitialBalance()))
                .totalEquity(valuation != null ? valuation.totalEquity() : cash)
                .createdAt(sandbox.getCreatedAt())
                .ownerId(sandbox.getUserId())
                .permission(permission)
                .shared(permission != AccessLevel.OWNER)
                .build();
    }
}
