package com.pagewatch.service.store;

import com.pagewatch.core.events.Event;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Journal of engine events. Queries return events in journal order, keeping the newest {@code limit}.
 */
public interface EventStore {
    void append(Event event);

    List<Event> query(Instant since, Optional<String> type, int limit);

    List<Event> history(String jobId, int limit);
}
