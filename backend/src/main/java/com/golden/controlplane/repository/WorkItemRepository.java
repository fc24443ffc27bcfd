package com.golden.controlplane.repository;

import com.golden.controlplane.model.WorkItem;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface WorkItemRepository extends JpaRepository<WorkItem, Long> {

    @Query("""
            select w.id from WorkItem w
            where w.status = :status
              and w.nextAttemptAt <= :now
            order by w.nextAttemptAt asc, w.id asc
            """)
    List<Long> findDueIds(@Param("status") WorkItem.Status status, @Param("now") Instant now, Pageable pageable);

    /**
     * Competing-consumer claim: only one worker's update matches the PENDING row.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update WorkItem w
            set w.status = :claimed,
                w.leaseExpiresAt = :leaseUntil,
                w.lastAttemptAt = :now,
                w.updatedAt = :now
            where w.id = :id
              and w.status = :pending
            """)
    int claim(@Param("id") Long id,
              @Param("pending") WorkItem.Status pending,
              @Param("claimed") WorkItem.Status claimed,
              @Param("now") Instant now,
              @Param("leaseUntil") Instant leaseUntil);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update WorkItem w
            set w.status = :pending,
                w.leaseExpiresAt = null,
                w.updatedAt = :now
            where w.status = :claimed
              and w.leaseExpiresAt < :now
            """)
    int releaseExpiredLeases(@Param("pending") WorkItem.Status pending,
                             @Param("claimed") WorkItem.Status claimed,
                             @Param("now") Instant now);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select w from WorkItem w where w.id = :id")
    Optional<WorkItem> findForUpdate(@Param("id") Long id);

    long countByStatus(WorkItem.Status status);

    List<WorkItem> findByDestinationOrderByIdAsc(String destination);
}
