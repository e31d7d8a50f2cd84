package com.nestegg.backend.service;

import com.nestegg.backend.model.EquitySnapshot;
import com.nestegg.backend.repository.EquitySnapshotRepository;
import com.nestegg.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Insert-or-replace store of daily equity, keyed by (sandbox, date). The latest write for a
 * day wins. Callers serialize writes per sandbox through {@link SandboxLockRegistry}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EquitySnapshotService {

    private final EquitySnapshotRepository snapshotRepository;
    private final Clock clock;

    @Transactional
    public EquitySnapshot upsertSnapshot(Long sandboxId, LocalDate date, BigDecimal totalEquity,
                                         BigDecimal cash, BigDecimal holdingsValue) {
        return upsert(sandboxId, new DailyEquity(date, cash, holdingsValue, totalEquity), Instant.now(clock));
    }

    @Transactional
    public void upsertAll(Long sandboxId, List<DailyEquity> days) {
        Instant now = Instant.now(clock);
        for (DailyEquity day : days) {
            upsert(sandboxId, day, now);
        }
        log.debug("Wrote {} equity snapshots for sandbox {}", days.size(), sandboxId);
    }

    @Transactional(readOnly = true)
    public List<EquitySnapshot> readSnapshots(Long sandboxId) {
        return snapshotRepository.findBySandboxIdOrderBySnapshotDateAsc(sandboxId);
    }

    private EquitySnapshot upsert(Long sandboxId, DailyEquity day, Instant writtenAt) {
        EquitySnapshot snapshot = snapshotRepository.findBySandboxIdAndSnapshotDate(sandboxId, day.date())
                .orElseGet(() -> EquitySnapshot.builder()
                        .sandboxId(sandboxId)
                        .snapshotDate(day.date())
                        .build());
        snapshot.setTotalEquity(MoneyUtils.scale(day.totalEquity()));
        snapshot.setCash(MoneyUtils.scale(day.cash()));
        snapshot.setHoldingsValue(MoneyUtils.scale(day.holdingsValue()));
        snapshot.setWrittenAt(writtenAt);
        return snapshotRepository.save(snapshot);
    }
}
