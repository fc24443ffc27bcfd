package com.golden.controlplane.service.dlq;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
@Slf4j
public class WorkItemHandlerRegistry {

    private final Map<String, WorkItemHandler> handlers = new ConcurrentHashMap<>();

    public WorkItemHandlerRegistry(List<WorkItemHandler> handlers) {
        handlers.forEach(this::register);
    }

    public void register(WorkItemHandler handler) {
        WorkItemHandler existing = handlers.putIfAbsent(handler.destination(), handler);
        if (existing != null && existing != handler) {
            throw new IllegalStateException("Handler already registered for destination " + handler.destination());
        }
        log.info("Registered work item handler for destination '{}'", handler.destination());
    }

    public void unregister(String destination) {
        handlers.remove(destination);
    }

    public Optional<WorkItemHandler> find(String destination) {
        return Optional.ofNullable(handlers.get(destination));
    }
}
