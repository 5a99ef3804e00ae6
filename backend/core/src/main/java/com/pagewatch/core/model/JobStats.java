package com.pagewatch.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record JobStats(
        String jobId,
        JobStatus status,
        Instant createdAt,
        Instant lastCheck,
        long totalChecks,
        long changesDetected,
        long failedChecks,
        String lastError,
        int retainedChanges,
        Map<String, Long> changeTypes,
        int annotatedChanges,
        int notableDetections,
        List<String> entitiesDetected
) {
}
