package com.pagewatch.core.events;

import com.pagewatch.core.model.JobStatus;

import java.time.Instant;

public record JobStatusChanged(
        Instant timestamp,
        String jobId,
        JobStatus previous,
        JobStatus current,
        String reason
) implements Event {
    @Override
    public String type() {
        return "JobStatusChanged";
    }
}
