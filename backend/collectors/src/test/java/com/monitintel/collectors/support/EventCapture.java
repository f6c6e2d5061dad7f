package com.monitintel.collectors.support;

import com.monitintel.core.bus.EventBus;
import com.monitintel.core.events.AlertRaised;
import com.monitintel.core.events.Event;
import com.monitintel.core.events.SnapshotsIngested;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class EventCapture {
    private final List<Event> events = new CopyOnWriteArrayList<>();

    public EventCapture(EventBus bus) {
        bus.subscribeAll(List.of(AlertRaised.class, SnapshotsIngested.class), events::add);
    }

    public <T extends Event> List<T> byType(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    public List<Event> all() {
        return List.copyOf(events);
    }
}
