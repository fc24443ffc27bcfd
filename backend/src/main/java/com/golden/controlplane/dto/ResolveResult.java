package com.golden.controlplane.dto;

/**
 * @param workItemId id of the republished work item when the message was requeued, otherwise null
 */
public record ResolveResult(String status, Long messageId, boolean requeued, Long workItemId) {

    public static final String RESOLVED = "resolved";
}
