package com.monitintel.service.store;

import com.monitintel.core.events.Event;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface EventStore {
    void append(Event event);

    List<Event> query(Instant since, Optional<String> type, int limit);

    /**
     * Drops events older than {@code cutoff}.
     *
     * @return number of dropped events
     */
    int compact(Instant cutoff);
}
