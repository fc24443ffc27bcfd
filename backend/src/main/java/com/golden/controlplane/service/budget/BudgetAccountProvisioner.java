package com.golden.controlplane.service.budget;

import com.golden.controlplane.config.ControlPlaneProperties;
import com.golden.controlplane.model.BudgetAccount;
import com.golden.controlplane.repository.BudgetAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Creates accounts in their own transaction so a losing insert race surfaces as a
 * {@link org.springframework.dao.DataIntegrityViolationException} the caller can absorb.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BudgetAccountProvisioner {

    private final BudgetAccountRepository accountRepository;
    private final ControlPlaneProperties properties;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public BudgetAccount create(String tenantId, String projectId) {
        Instant now = Instant.now(clock);
        BudgetAccount account = accountRepository.saveAndFlush(BudgetAccount.builder()
                .tenantId(tenantId)
                .projectId(projectId)
                .totalLimit(properties.getBudget().getDefaultTotalLimit())
                .used(0L)
                .reserved(0L)
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.info("Created budget account tenant={} project={} limit={}", tenantId, projectId, account.getTotalLimit());
        return account;
    }
}
