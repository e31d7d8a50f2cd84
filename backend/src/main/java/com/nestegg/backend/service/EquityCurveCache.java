package com.nestegg.backend.service;

import com.nestegg.backend.config.SandboxProperties;
import com.nestegg.backend.dto.EquityPointDTO;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Computed equity curves by sandbox id, kept for {@code sandbox.history-ttl-seconds} or
 * until the sandbox trades.
 */
@Component
@RequiredArgsConstructor
public class EquityCurveCache {

    private final SandboxProperties sandboxProperties;
    private final Clock clock;
    private final Map<Long, Entry> entries = new ConcurrentHashMap<>();

    public Optional<List<EquityPointDTO>> get(Long sandboxId) {
        Entry entry = entries.get(sandboxId);
        if (entry == null) {
            return Optional.empty();
        }
        if (Duration.between(entry.storedAt(), Instant.now(clock)).getSeconds() >= sandboxProperties.getHistoryTtlSeconds()) {
            entries.remove(sandboxId, entry);
            return Optional.empty();
        }
        return Optional.of(entry.points());
    }

    public void put(Long sandboxId, List<EquityPointDTO> points) {
        entries.put(sandboxId, new Entry(List.copyOf(points), Instant.now(clock)));
    }

    public void invalidate(Long sandboxId) {
        entries.remove(sandboxId);
    }

    private record Entry(List<EquityPointDTO> points, Instant storedAt) {
    }
}
