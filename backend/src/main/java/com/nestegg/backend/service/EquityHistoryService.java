package com.nestegg.backend.service;

import com.nestegg.backend.config.SandboxProperties;
import com.nestegg.backend.dto.EquityPointDTO;
import com.nestegg.backend.exception.HistorySeedException;
import com.nestegg.backend.exception.MarketDataException;
import com.nestegg.backend.model.EquitySnapshot;
import com.nestegg.backend.model.Sandbox;
import com.nestegg.backend.model.SandboxTransaction;
import com.nestegg.backend.repository.SandboxTransactionRepository;
import com.nestegg.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Produces a sandbox's daily equity curve. Two or more stored snapshots are served as-is;
 * otherwise the curve is seeded by replaying the transaction log against historical closes
 * and the result is written back as snapshots.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EquityHistoryService {

    private final EquitySnapshotService snapshotService;
    private final SandboxTransactionRepository transactionRepository;
    private final PriceCacheService priceCacheService;
    private final SandboxLockRegistry lockRegistry;
    private final EquityCurveCache curveCache;
    private final SandboxProperties sandboxProperties;
    private final Clock clock;

    /**
     * @param liveEquity current total equity, used as the end point of the fallback curve;
     *                   may be null
     */
    public EquityCurve equityCurve(Sandbox sandbox, BigDecimal liveEquity) {
        Optional<List<EquityPointDTO>> cached = curveCache.get(sandbox.getId());
        if (cached.isPresent()) {
            return new EquityCurve(cached.get(), null);
        }
        List<EquitySnapshot> snapshots = snapshotService.readSnapshots(sandbox.getId());
        if (snapshots.size() >= 2) {
            List<EquityPointDTO> points = snapshots.stream()
                    .map(snapshot -> point(snapshot.getSnapshotDate(), snapshot.getTotalEquity()))
                    .collect(Collectors.toList());
            curveCache.put(sandbox.getId(), points);
            return new EquityCurve(points, null);
        }
        try {
            List<EquityPointDTO> points = seed(sandbox);
            curveCache.put(sandbox.getId(), points);
            return new EquityCurve(points, null);
        } catch (HistorySeedException e) {
            log.warn("Equity history seed failed for sandbox {}: {}", sandbox.getId(), e.getMessage());
            return fallback(sandbox, liveEquity, e.getMessage());
        }
    }

    List<EquityPointDTO> seed(Sandbox sandbox) {
        try {
            ZoneId zone = sandboxProperties.zoneId();
            List<SandboxTransaction> transactions =
                    transactionRepository.findBySandboxIdOrderByExecutedAtAscIdAsc(sandbox.getId());
            LocalDate today = LocalDate.ofInstant(Instant.now(clock), zone);
            LocalDate start = LocalDate.ofInstant(sandbox.getCreatedAt(), zone);
            if (!transactions.isEmpty()) {
                LocalDate firstTrade = LocalDate.ofInstant(transactions.get(0).getExecutedAt(), zone);
                if (firstTrade.isBefore(start)) {
                    start = firstTrade;
                }
            }
            if (start.isAfter(today)) {
                start = today;
            }
            Set<String> symbols = transactions.stream()
                    .map(SandboxTransaction::getSymbol)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            Map<String, PriceSeries> closes = symbols.isEmpty()
                    ? Map.of()
                    : priceCacheService.historicalCloses(symbols, start, today);

            LedgerReplayer replayer = new LedgerReplayer(zone, sandboxProperties.getLotEpsilon());
            List<DailyEquity> days = replayer.replay(sandbox.getInitialBalance(), transactions, start, today, closes);
            lockRegistry.runLocked(sandbox.getId(), () -> snapshotService.upsertAll(sandbox.getId(), days));
            log.info("Seeded {} days of equity history for sandbox {} from {}", days.size(), sandbox.getId(), start);

            List<EquityPointDTO> points = new ArrayList<>(days.size());
            for (DailyEquity day : days) {
                points.add(point(day.date(), day.totalEquity()));
            }
            return points;
        } catch (HistorySeedException e) {
            throw e;
        } catch (MarketDataException e) {
            throw new HistorySeedException("Historical prices unavailable: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new HistorySeedException("Could not rebuild equity history: " + e.getMessage(), e);
        }
    }

    private EquityCurve fallback(Sandbox sandbox, BigDecimal liveEquity, String reason) {
        BigDecimal initial = MoneyUtils.scale(sandbox.getInitialBalance());
        BigDecimal end = liveEquity != null ? MoneyUtils.scale(liveEquity) : initial;
        ZoneId zone = sandboxProperties.zoneId();
        Instant now = Instant.now(clock);
        List<EquityPointDTO> points = List.of(
                EquityPointDTO.builder()
                        .timestamp(sandbox.getCreatedAt().toEpochMilli())
                        .date(LocalDate.ofInstant(sandbox.getCreatedAt(), zone))
                        .value(initial)
                        .build(),
                EquityPointDTO.builder()
                        .timestamp(now.toEpochMilli())
                        .date(LocalDate.ofInstant(now, zone))
                        .value(end)
                        .build());
        return new EquityCurve(points, reason);
    }

    EquityPointDTO point(LocalDate date, BigDecimal value) {
        return EquityPointDTO.builder()
                .timestamp(date.atStartOfDay(sandboxProperties.zoneId()).toInstant().toEpochMilli())
                .date(date)
                .value(MoneyUtils.scale(value))
                .build();
    }

    public void invalidate(Long sandboxId) {
        curveCache.invalidate(sandboxId);
    }

    public record EquityCurve(List<EquityPointDTO> points, String historyError) {
    }
}
