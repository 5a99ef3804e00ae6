package com.pagewatch.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagewatch.core.model.ChangeRecord;
import com.pagewatch.core.model.Job;
import com.pagewatch.core.util.JsonUtils;
import com.pagewatch.monitor.api.JobStore;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps all job records and the retired ids in {@code jobs.json} and the retained results of
 * each job in {@code results/<jobId>.json} under the state directory.
 */
public class JsonFileJobStore implements JobStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path jobsFile;
    private final Path resultsDir;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final Set<String> retiredIds = new LinkedHashSet<>();

    public JsonFileJobStore(Path stateDir) {
        this.jobsFile = stateDir.resolve("jobs.json");
        this.resultsDir = stateDir.resolve("results");
        loadIfPresent();
    }

    @Override
    public List<Job> loadJobs() {
        lock.lock();
        try {
            return List.copyOf(jobs.values());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void saveJob(Job job) {
        lock.lock();
        try {
            jobs.put(job.id(), job);
            persistJobs();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void deleteJob(String jobId) {
        lock.lock();
        try {
            jobs.remove(jobId);
            retiredIds.add(jobId);
            persistJobs();
            Files.deleteIfExists(resultsFile(jobId));
        } catch (IOException e) {
            throw new IllegalStateException("Failed deleting results of " + jobId + " from " + resultsDir, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<String> loadRetiredIds() {
        lock.lock();
        try {
            return Set.copyOf(retiredIds);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ChangeRecord> loadResults(String jobId) {
        Path file = resultsFile(jobId);
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            try (InputStream in = Files.newInputStream(file)) {
                ResultsFile loaded = MAPPER.readValue(in, ResultsFile.class);
                return loaded.records() == null ? List.of() : List.copyOf(loaded.records());
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading results from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void saveResults(String jobId, List<ChangeRecord> records) {
        Path file = resultsFile(jobId);
        lock.lock();
        try {
            Files.createDirectories(resultsDir);
            try (OutputStream out = Files.newOutputStream(file)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, new ResultsFile(jobId, records));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing results to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private Path resultsFile(String jobId) {
        if (jobId.isBlank() || jobId.contains("/") || jobId.contains("\\") || jobId.contains("..")) {
            throw new IllegalArgumentException("Job id is not usable as a file name: " + jobId);
        }
        return resultsDir.resolve(jobId + ".json");
    }

    private void loadIfPresent() {
        lock.lock();
        try {
            if (!Files.exists(jobsFile)) {
                return;
            }
            try (InputStream in = Files.newInputStream(jobsFile)) {
                JobsFile loaded = MAPPER.readValue(in, JobsFile.class);
                if (loaded.jobs() != null) {
                    loaded.jobs().forEach(job -> jobs.put(job.id(), job));
                }
                if (loaded.retiredIds() != null) {
                    retiredIds.addAll(loaded.retiredIds());
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading jobs from " + jobsFile, e);
        } finally {
            lock.unlock();
        }
    }

    private void persistJobs() {
        try {
            Files.createDirectories(jobsFile.getParent());
            try (OutputStream out = Files.newOutputStream(jobsFile)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, new JobsFile(new ArrayList<>(jobs.values()), new ArrayList<>(retiredIds)));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing jobs to " + jobsFile, e);
        }
    }

    private record JobsFile(List<Job> jobs, List<String> retiredIds) {
    }

    private record ResultsFile(String jobId, List<ChangeRecord> records) {
    }
}
