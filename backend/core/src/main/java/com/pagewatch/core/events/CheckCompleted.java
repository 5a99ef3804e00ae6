package com.pagewatch.core.events;

import java.time.Instant;

public record CheckCompleted(
        Instant timestamp,
        String jobId,
        String url,
        boolean success,
        int changeCount,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "CheckCompleted";
    }
}
