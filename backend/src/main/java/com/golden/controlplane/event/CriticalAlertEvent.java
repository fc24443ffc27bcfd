package com.golden.controlplane.event;

import java.time.Instant;
import java.util.Map;

public record CriticalAlertEvent(
        String type,
        String message,
        Throwable cause,
        Instant raisedAt,
        Map<String, Object> metadata
) {
}
