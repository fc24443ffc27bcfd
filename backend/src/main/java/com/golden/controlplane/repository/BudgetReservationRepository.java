package com.golden.controlplane.repository;

import com.golden.controlplane.model.BudgetReservation;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface BudgetReservationRepository extends JpaRepository<BudgetReservation, Long> {

    Optional<BudgetReservation> findByReservationId(String reservationId);

    Optional<BudgetReservation> findByTenantIdAndRequestId(String tenantId, String requestId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from BudgetReservation r where r.reservationId = :reservationId")
    Optional<BudgetReservation> findForUpdate(@Param("reservationId") String reservationId);

    @Query("""
            select r.reservationId from BudgetReservation r
            where r.status = :status
              and r.createdAt < :cutoff
            order by r.createdAt asc
            """)
    List<String> findReservationIdsCreatedBefore(@Param("status") BudgetReservation.Status status,
                                                 @Param("cutoff") Instant cutoff,
                                                 Pageable pageable);
}
