package com.nestegg.backend.repository;

import com.nestegg.backend.model.SandboxShare;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SandboxShareRepository extends JpaRepository<SandboxShare, Long> {
    Optional<SandboxShare> findBySandboxIdAndSharedWithId(Long sandboxId, Long sharedWithId);
    List<SandboxShare> findBySharedWithIdOrderByCreatedAtDesc(Long sharedWithId);

    @Modifying
    @Query("delete from SandboxShare s where s.sandboxId = :sandboxId")
    int deleteBySandboxId(@Param("sandboxId") Long sandboxId);
}
