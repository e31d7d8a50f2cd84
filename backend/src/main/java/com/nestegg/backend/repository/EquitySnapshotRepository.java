package com.nestegg.backend.repository;

import com.nestegg.backend.model.EquitySnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface EquitySnapshotRepository extends JpaRepository<EquitySnapshot, Long> {
    Optional<EquitySnapshot> findBySandboxIdAndSnapshotDate(Long sandboxId, LocalDate snapshotDate);
    List<EquitySnapshot> findBySandboxIdOrderBySnapshotDateAsc(Long sandboxId);
    long countBySandboxId(Long sandboxId);

    @Modifying
    @Query("delete from EquitySnapshot s where s.sandboxId = :sandboxId")
    int deleteBySandboxId(@Param("sandboxId") Long sandboxId);
}
