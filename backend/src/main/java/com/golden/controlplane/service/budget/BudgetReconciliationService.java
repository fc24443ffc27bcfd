package com.golden.controlplane.service.budget;

import com.golden.controlplane.config.ControlPlaneProperties;
import com.golden.controlplane.dto.LedgerReconciliation;
import com.golden.controlplane.model.BudgetAccount;
import com.golden.controlplane.service.AlertService;
import com.golden.controlplane.service.ScheduledTaskGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Replays every account's transaction log against its live fields and raises a critical alert on
 * any mismatch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetReconciliationService {

    private final BudgetLedger ledger;
    private final AlertService alertService;
    private final ControlPlaneProperties properties;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(fixedDelayString = "${control-plane.budget.reconciliation-interval-ms:300000}")
    public void periodicReconcile() {
        if (properties.getBudget().isReconciliationEnabled()) {
            scheduledTaskGuard.run("budget-reconciliation", this::reconcileAll);
        }
    }

    public List<LedgerReconciliation> reconcileAll() {
        List<LedgerReconciliation> mismatches = new ArrayList<>();
        List<BudgetAccount> accounts = ledger.accounts();
        for (BudgetAccount account : accounts) {
            LedgerReconciliation result = ledger.verify(account.getTenantId(), account.getProjectId());
            if (!result.consistent()) {
                mismatches.add(result);
                alertService.sendAlert("BUDGET_LEDGER_MISMATCH",
                        "Ledger replay disagrees with account " + account.getTenantId() + "/" + account.getProjectId()
                                + ": live used=" + result.liveUsed() + " reserved=" + result.liveReserved()
                                + ", replayed used=" + result.replayedUsed() + " reserved=" + result.replayedReserved(),
                        null,
                        Map.of("tenantId", account.getTenantId(), "projectId", account.getProjectId()));
            }
        }
        log.info("Budget reconciliation checked {} accounts, {} mismatches", accounts.size(), mismatches.size());
        return mismatches;
    }
}
