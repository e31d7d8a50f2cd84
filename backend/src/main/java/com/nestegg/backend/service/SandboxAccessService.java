package com.nestegg.backend.service;

import com.nestegg.backend.exception.NotFoundException;
import com.nestegg.backend.exception.PermissionDeniedException;
import com.nestegg.backend.model.AccessLevel;
import com.nestegg.backend.model.Sandbox;
import com.nestegg.backend.repository.SandboxRepository;
import com.nestegg.backend.repository.SandboxShareRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves what a caller may do with a sandbox: owners have full rights, grantees get
 * whatever their share row says, everyone else gets nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SandboxAccessService {

    private final SandboxRepository sandboxRepository;
    private final SandboxShareRepository sandboxShareRepository;

    @Transactional(readOnly = true)
    public Optional<SandboxAccess> resolveAccess(Long sandboxId, Long callerId) {
        return sandboxRepository.findById(sandboxId)
                .flatMap(sandbox -> resolve(sandbox, callerId));
    }

    @Transactional(readOnly = true)
    public SandboxAccess requireWatch(Long sandboxId, Long callerId) {
        return require(sandboxId, callerId, AccessLevel.WATCH);
    }

    @Transactional(readOnly = true)
    public SandboxAccess requireEdit(Long sandboxId, Long callerId) {
        return require(sandboxId, callerId, AccessLevel.EDIT);
    }

    @Transactional(readOnly = true)
    public SandboxAccess requireOwner(Long sandboxId, Long callerId) {
        return require(sandboxId, callerId, AccessLevel.OWNER);
    }

    private SandboxAccess require(Long sandboxId, Long callerId, AccessLevel needed) {
        Sandbox sandbox = sandboxRepository.findById(sandboxId)
                .orElseThrow(() -> new NotFoundException("Sandbox not found: " + sandboxId));
        SandboxAccess access = resolve(sandbox, callerId)
                .orElseThrow(() -> denied(sandboxId, callerId, needed));
        if (access.level().compareTo(needed) < 0) {
            throw denied(sandboxId, callerId, needed);
        }
        return access;
    }

    private Optional<SandboxAccess> resolve(Sandbox sandbox, Long callerId) {
        if (callerId == null) {
            return Optional.empty();
        }
        if (Objects.equals(sandbox.getUserId(), callerId)) {
            return Optional.of(new SandboxAccess(sandbox, sandbox.getUserId(), AccessLevel.OWNER));
        }
        return sandboxShareRepository.findBySandboxIdAndSharedWithId(sandbox.getId(), callerId)
                .map(share -> new SandboxAccess(sandbox, sandbox.getUserId(), AccessLevel.from(share.getPermission())));
    }

    private PermissionDeniedException denied(Long sandboxId, Long callerId, AccessLevel needed) {
        log.info("User {} denied {} access to sandbox {}", callerId, needed, sandboxId);
        return new PermissionDeniedException(needed == AccessLevel.WATCH
                ? "You do not have access to this sandbox"
                : "You do not have " + needed.name().toLowerCase() + " permission on this sandbox");
    }

    public record SandboxAccess(Sandbox sandbox, Long ownerId, AccessLevel level) {
    }
}
