package com.pagewatch.service.runtime;

public class JobAlreadyRunningException extends IllegalStateException {
    public JobAlreadyRunningException(String jobId) {
        super("Job is already running: " + jobId);
    }
}
