package com.golden.controlplane.repository;

import com.golden.controlplane.model.GovernanceRule;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface GovernanceRuleRepository extends JpaRepository<GovernanceRule, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from GovernanceRule r where r.role = :role")
    Optional<GovernanceRule> findForUpdate(@Param("role") String role);

    List<GovernanceRule> findAllByOrderByRoleAsc();
}
