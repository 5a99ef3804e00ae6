package com.pagewatch.monitor.config;

import java.time.Duration;

/**
 * Tunables of the monitoring engine. Absent values fall back to the defaults below.
 */
public record EngineConfig(
        Integer ledgerCapacity,
        Duration minimumInterval,
        Duration fetchTimeout,
        Integer failureThreshold,
        Boolean resumeRunningJobs,
        String stateDir,
        AnnotationConfig annotation
) {
    public static final int DEFAULT_LEDGER_CAPACITY = 200;
    public static final Duration DEFAULT_MINIMUM_INTERVAL = Duration.ofMinutes(1);
    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_FAILURE_THRESHOLD = 3;

    public EngineConfig {
        ledgerCapacity = ledgerCapacity == null ? DEFAULT_LEDGER_CAPACITY : ledgerCapacity;
        minimumInterval = minimumInterval == null ? DEFAULT_MINIMUM_INTERVAL : minimumInterval;
        fetchTimeout = fetchTimeout == null ? DEFAULT_FETCH_TIMEOUT : fetchTimeout;
        failureThreshold = failureThreshold == null ? DEFAULT_FAILURE_THRESHOLD : failureThreshold;
        resumeRunningJobs = resumeRunningJobs != null && resumeRunningJobs;
        stateDir = stateDir == null || stateDir.isBlank() ? "state" : stateDir;
        annotation = annotation == null ? AnnotationConfig.defaults() : annotation;
        if (ledgerCapacity < 1) {
            throw new IllegalArgumentException("ledgerCapacity must be positive");
        }
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        if (minimumInterval.isNegative() || minimumInterval.isZero()) {
            throw new IllegalArgumentException("minimumInterval must be positive");
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig(null, null, null, null, null, null, null);
    }
}
