package com.golden.controlplane.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record TokenRequest(
        @NotBlank @Size(max = 128) String tenantId,
        @NotBlank @Size(max = 128) String projectId,
        @NotBlank @Size(max = 128) String taskId,
        @NotBlank @Size(max = 128) String model,
        @Positive long estimatedTokens,
        @NotBlank @Size(max = 128) String requestId,
        @NotBlank @Size(max = 256) String purpose
) {
}
