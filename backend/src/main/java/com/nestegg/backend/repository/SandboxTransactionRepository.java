package com.nestegg.backend.repository;

import com.nestegg.backend.model.SandboxTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SandboxTransactionRepository extends JpaRepository<SandboxTransaction, Long> {

    // Replay order
    List<SandboxTransaction> findBySandboxIdOrderByExecutedAtAscIdAsc(Long sandboxId);

    // Display order
    List<SandboxTransaction> findBySandboxIdOrderByExecutedAtDescIdDesc(Long sandboxId);

    @Modifying
    @Query("delete from SandboxTransaction t where t.sandboxId = :sandboxId")
    int deleteBySandboxId(@Param("sandboxId") Long sandboxId);
}
