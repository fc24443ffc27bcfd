package com.golden.controlplane.dto;

public record LedgerReconciliation(
        String tenantId,
        String projectId,
        long liveUsed,
        long liveReserved,
        long replayedUsed,
        long replayedReserved,
        long transactionCount
) {

    public boolean consistent() {
        return liveUsed == replayedUsed && liveReserved == replayedReserved;
    }
}
