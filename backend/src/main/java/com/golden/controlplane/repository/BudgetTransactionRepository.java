package com.golden.controlplane.repository;

import com.golden.controlplane.model.BudgetTransaction;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BudgetTransactionRepository extends JpaRepository<BudgetTransaction, Long> {

    List<BudgetTransaction> findByTenantIdAndProjectIdOrderByIdAsc(String tenantId, String projectId);

    List<BudgetTransaction> findByReservationIdOrderByIdAsc(String reservationId);

    long countByTenantIdAndRequestIdAndType(String tenantId, String requestId, BudgetTransaction.Type type);
}
