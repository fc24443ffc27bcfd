package com.golden.controlplane.repository;

import com.golden.controlplane.model.BudgetAccount;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface BudgetAccountRepository extends JpaRepository<BudgetAccount, Long> {

    Optional<BudgetAccount> findByTenantIdAndProjectId(String tenantId, String projectId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from BudgetAccount a where a.tenantId = :tenantId and a.projectId = :projectId")
    Optional<BudgetAccount> findForUpdate(@Param("tenantId") String tenantId, @Param("projectId") String projectId);
}
