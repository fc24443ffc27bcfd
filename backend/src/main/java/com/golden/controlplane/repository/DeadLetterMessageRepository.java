package com.golden.controlplane.repository;

import com.golden.controlplane.model.DeadLetterMessage;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface DeadLetterMessageRepository extends JpaRepository<DeadLetterMessage, Long> {

    List<DeadLetterMessage> findByResolvedOrderByCreatedAtDescIdDesc(boolean resolved, Pageable pageable);

    List<DeadLetterMessage> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);

    long countByResolvedFalse();

    List<DeadLetterMessage> findByOriginalDestinationOrderByIdAsc(String originalDestination);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select m from DeadLetterMessage m where m.id = :id")
    Optional<DeadLetterMessage> findForUpdate(@Param("id") Long id);
}
