package com.nestegg.backend.service;

import com.nestegg.backend.config.SandboxProperties;
import com.nestegg.backend.exception.ConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair lock per sandbox. Trades and snapshot writes for the same sandbox run one at a
 * time; different sandboxes never contend. An entry lives only while some thread holds or
 * waits for it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SandboxLockRegistry {

    private final SandboxProperties sandboxProperties;
    private final Map<Long, SandboxLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(Long sandboxId, Supplier<T> action) {
        SandboxLock entry = retain(sandboxId);
        try {
            boolean acquired;
            try {
                acquired = entry.lock.tryLock(sandboxProperties.getLockTimeoutMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConflictException("Interrupted while waiting for sandbox " + sandboxId);
            }
            if (!acquired) {
                log.warn("Timed out after {} ms waiting for sandbox {} lock", sandboxProperties.getLockTimeoutMillis(), sandboxId);
                throw new ConflictException("Sandbox " + sandboxId + " is busy, try again");
            }
            try {
                return action.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            release(sandboxId);
        }
    }

    public void runLocked(Long sandboxId, Runnable action) {
        withLock(sandboxId, () -> {
            action.run();
            return null;
        });
    }

    int trackedLocks() {
        return locks.size();
    }

    // users is only touched inside compute, which is atomic per key
    private SandboxLock retain(Long sandboxId) {
        return locks.compute(sandboxId, (id, existing) -> {
            SandboxLock entry = existing != null ? existing : new SandboxLock();
            entry.users++;
            return entry;
        });
    }

    private void release(Long sandboxId) {
        locks.computeIfPresent(sandboxId, (id, entry) -> --entry.users == 0 ? null : entry);
    }

    private static final class SandboxLock {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
