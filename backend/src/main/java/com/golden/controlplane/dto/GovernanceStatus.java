package com.golden.controlplane.dto;

import java.time.Duration;
import java.time.Instant;

public record GovernanceStatus(
        String role,
        int maxUpdatesPerDay,
        Duration cooldown,
        boolean requiresHumanApproval,
        Instant lastUpdateAt,
        long autoUpdatesLast24h,
        long pendingApprovals,
        String status
) {
    public static final String REQUIRES_APPROVAL = "requires_approval";
    public static final String DAILY_LIMIT_REACHED = "daily_limit_reached";
    public static final String COOLDOWN_ACTIVE = "cooldown_active";
    public static final String CAN_AUTO_UPDATE = "can_auto_update";
}
