package com.golden.controlplane.service.dlq;

/**
 * Consumer for one destination. Handlers see at-least-once delivery and must tolerate replays.
 */
public interface WorkItemHandler {

    String destination();

    void handle(String payload) throws Exception;
}
