package com.golden.controlplane.dto;

public record BudgetSnapshot(String tenantId, String projectId, long total, long used, long reserved, long available) {
}
