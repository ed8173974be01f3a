package com.phillippitts.engramdesk.testutil;

import com.phillippitts.engramdesk.service.sidecar.event.SidecarStatusChangedEvent;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for ApplicationEventPublisher that captures events for verification.
 *
 * <p>Thread-safe implementation using CopyOnWriteArrayList for concurrent test scenarios.
 */
public class EventCapturingPublisher implements ApplicationEventPublisher {
    final List<Object> events = new CopyOnWriteArrayList<>();

    @Override
    public void publishEvent(ApplicationEvent event) {
        events.add(event);
    }

    @Override
    public void publishEvent(Object event) {
        events.add(event);
    }

    /**
     * Values of the captured sidecar status notices, in publish order.
     */
    public List<String> statusValues() {
        return events.stream()
                .filter(e -> e instanceof SidecarStatusChangedEvent)
                .map(e -> ((SidecarStatusChangedEvent) e).value())
                .toList();
    }

    /**
     * Clears all captured events (useful for multi-iteration tests).
     */
    public void clear() {
        events.clear();
    }
}
