package com.pagewatch.monitor.api;

import com.pagewatch.core.model.ChangeRecord;
import com.pagewatch.core.model.Job;

import java.util.List;
import java.util.Set;

public interface JobStore {
    List<Job> loadJobs();

    void saveJob(Job job);

    /**
     * Removes the job and its results and retires the id for good.
     */
    void deleteJob(String jobId);

    Set<String> loadRetiredIds();

    List<ChangeRecord> loadResults(String jobId);

    void saveResults(String jobId, List<ChangeRecord> records);
}
