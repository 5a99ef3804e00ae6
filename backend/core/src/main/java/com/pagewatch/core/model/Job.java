package com.pagewatch.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Metadata of one monitoring job. Instances are immutable; the job registry replaces the
 * record on every update so readers never observe a half-applied check.
 */
public record Job(
        String id,
        String name,
        String url,
        Duration checkInterval,
        JobStatus status,
        Instant createdAt,
        Instant lastCheck,
        long totalChecks,
        long changesDetected,
        long failedChecks,
        int consecutiveFailures,
        String lastError
) {
    public Job {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(checkInterval, "checkInterval is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
    }

    public static Job created(String id, String name, String url, Duration checkInterval, Instant createdAt) {
        return new Job(id, name, url, checkInterval, JobStatus.CREATED, createdAt, null, 0, 0, 0, 0, null);
    }

    public Job withStatus(JobStatus next) {
        return new Job(id, name, url, checkInterval, next, createdAt, lastCheck,
                totalChecks, changesDetected, failedChecks, consecutiveFailures, lastError);
    }

    /**
     * Moves the job to RUNNING with a fresh failure streak; counters and the last error are kept.
     */
    public Job startedRunning() {
        return new Job(id, name, url, checkInterval, JobStatus.RUNNING, createdAt, lastCheck,
                totalChecks, changesDetected, failedChecks, 0, lastError);
    }

    /**
     * Applies a successful check: counters advance, the timestamp moves and any stale error is cleared.
     */
    public Job withCheckSucceeded(Instant checkedAt, int newChanges) {
        return new Job(id, name, url, checkInterval, status, createdAt, checkedAt,
                totalChecks + 1, changesDetected + newChanges, failedChecks, 0, null);
    }

    /**
     * Applies a failed fetch. {@code lastCheck} and {@code totalChecks} only track successful checks.
     */
    public Job withCheckFailed(String message) {
        return new Job(id, name, url, checkInterval, status, createdAt, lastCheck,
                totalChecks, changesDetected, failedChecks + 1, consecutiveFailures + 1, message);
    }

    /**
     * Moves the job to ERROR for a reason other than a failed fetch; check counters are kept.
     */
    public Job withError(String message) {
        return new Job(id, name, url, checkInterval, JobStatus.ERROR, createdAt, lastCheck,
                totalChecks, changesDetected, failedChecks, consecutiveFailures, message);
    }

    @JsonIgnore
    public boolean isRunning() {
        return status == JobStatus.RUNNING;
    }
}
