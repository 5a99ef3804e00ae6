package com.pagewatch.core.events;

import java.time.Instant;
import java.util.Map;

public record AlertRaised(
        Instant timestamp,
        String jobId,
        String category,
        String message,
        Map<String, Object> details
) implements Event {
    @Override
    public String type() {
        return "AlertRaised";
    }
}
