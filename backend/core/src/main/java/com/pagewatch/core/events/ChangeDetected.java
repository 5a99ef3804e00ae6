package com.pagewatch.core.events;

import com.pagewatch.core.model.ChangeType;

import java.time.Instant;

public record ChangeDetected(
        Instant timestamp,
        String jobId,
        ChangeType changeType,
        String description,
        boolean annotated
) implements Event {
    @Override
    public String type() {
        return "ChangeDetected";
    }
}
