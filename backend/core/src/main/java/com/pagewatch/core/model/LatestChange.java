package com.pagewatch.core.model;

import java.util.Objects;

public record LatestChange(String jobId, String jobName, String url, ChangeRecord change) {
    public LatestChange {
        Objects.requireNonNull(jobId, "jobId is required");
        Objects.requireNonNull(change, "change is required");
    }
}
