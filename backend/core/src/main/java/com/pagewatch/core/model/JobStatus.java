package com.pagewatch.core.model;

public enum JobStatus {
    CREATED,
    RUNNING,
    PAUSED,
    STOPPED,
    ERROR,
    DELETED;

    public boolean isStartable() {
        return this == CREATED || this == PAUSED || this == STOPPED || this == ERROR;
    }
}
