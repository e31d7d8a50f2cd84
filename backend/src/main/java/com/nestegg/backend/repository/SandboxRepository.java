package com.nestegg.backend.repository;

import com.nestegg.backend.model.Sandbox;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface SandboxRepository extends JpaRepository<Sandbox, Long> {
    List<Sandbox> findByUserIdOrderByCreatedAtDesc(Long userId);
    List<Sandbox> findByIdIn(Collection<Long> ids);
}
