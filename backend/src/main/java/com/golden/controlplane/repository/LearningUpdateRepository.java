package com.golden.controlplane.repository;

import com.golden.controlplane.model.LearningUpdate;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface LearningUpdateRepository extends JpaRepository<LearningUpdate, Long> {

    long countByRoleAndStatusAndCreatedAtAfter(String role, LearningUpdate.Status status, Instant since);

    long countByRoleAndStatus(String role, LearningUpdate.Status status);

    List<LearningUpdate> findByStatusOrderByCreatedAtAsc(LearningUpdate.Status status);

    List<LearningUpdate> findByRoleOrderByIdAsc(String role);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from LearningUpdate u where u.id = :id")
    Optional<LearningUpdate> findForUpdate(@Param("id") Long id);
}
