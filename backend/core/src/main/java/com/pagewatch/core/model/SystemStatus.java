package com.pagewatch.core.model;

import java.util.Map;

public record SystemStatus(int totalJobs, Map<JobStatus, Integer> byStatus) {
    public SystemStatus {
        byStatus = Map.copyOf(byStatus);
    }

    public int count(JobStatus status) {
        return byStatus.getOrDefault(status, 0);
    }
}
