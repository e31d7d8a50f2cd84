package com.nestegg.backend.repository;

import com.nestegg.backend.model.SandboxLot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface SandboxLotRepository extends JpaRepository<SandboxLot, Long> {
    List<SandboxLot> findBySandboxIdOrderBySymbolAsc(Long sandboxId);
    List<SandboxLot> findBySandboxIdIn(Collection<Long> sandboxIds);
    Optional<SandboxLot> findBySandboxIdAndSymbol(Long sandboxId, String symbol);

    @Modifying
    @Query("delete from SandboxLot l where l.sandboxId = :sandboxId")
    int deleteBySandboxId(@Param("sandboxId") Long sandboxId);
}
