package com.pagewatch.service.runtime;

import com.pagewatch.core.model.ChangeRecord;
import com.pagewatch.core.model.Job;
import com.pagewatch.core.model.JobStats;
import com.pagewatch.core.model.JobStatus;
import com.pagewatch.core.model.LatestChange;
import com.pagewatch.core.model.SystemStatus;
import com.pagewatch.monitor.annotation.AnnotationPort;
import com.pagewatch.monitor.api.Annotator;
import com.pagewatch.service.stats.StatsAggregator;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Logger;

/**
 * Entry point for callers: job lifecycle, result queries and statistics.
 */
public class MonitorService {
    private static final Logger LOGGER = Logger.getLogger(MonitorService.class.getName());
    private static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(1);

    private final JobRegistry registry;
    private final SchedulerService scheduler;
    private final Annotator annotator;
    private final Duration minimumInterval;

    public MonitorService(JobRegistry registry, SchedulerService scheduler, Annotator annotator, Duration minimumInterval) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler is required");
        this.annotator = Objects.requireNonNull(annotator, "annotator is required");
        this.minimumInterval = Objects.requireNonNull(minimumInterval, "minimumInterval is required");
    }

    public Job create(String name, String url, Duration checkInterval) {
        if (name == null || name.isBlank()) {
            throw new JobValidationException("name must not be blank");
        }
        Duration interval = checkInterval == null ? max(DEFAULT_INTERVAL, minimumInterval) : checkInterval;
        if (interval.compareTo(minimumInterval) < 0) {
            throw new JobValidationException("checkInterval must be at least " + minimumInterval);
        }
        return registry.create(name.trim(), validUrl(url), interval);
    }

    public List<Job> list() {
        return registry.list();
    }

    public Job get(String jobId) {
        return registry.get(jobId);
    }

    /**
     * Starts a worker for the job. A non-blank credential enables annotation for this run only.
     */
    public Job start(String jobId, String credential) {
        CancellationToken token = registry.bindWorker(jobId);
        try {
            scheduler.launch(token, AnnotationPort.forCredential(annotator, credential));
        } catch (RejectedExecutionException e) {
            registry.releaseWorker(jobId, JobStatus.STOPPED, "not scheduled");
            token.markTerminated();
            throw new IllegalStateException("Scheduler is shut down; job " + jobId + " was not started", e);
        }
        return registry.get(jobId);
    }

    public Job stop(String jobId) {
        return registry.releaseWorker(jobId, JobStatus.STOPPED, "stopped");
    }

    public Job pause(String jobId) {
        return registry.releaseWorker(jobId, JobStatus.PAUSED, "paused");
    }

    public void delete(String jobId) {
        registry.delete(jobId);
    }

    public List<ChangeRecord> results(String jobId, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        return registry.results(jobId, limit);
    }

    public JobStats stats(String jobId) {
        Job job = registry.get(jobId);
        return StatsAggregator.aggregate(job, registry.allResults(jobId));
    }

    public SystemStatus systemStatus() {
        return registry.systemStatus();
    }

    /**
     * Starts every job that is not running and returns the jobs that were started.
     */
    public List<Job> startAll(String credential) {
        List<Job> started = new ArrayList<>();
        for (Job job : registry.list()) {
            if (!job.status().isStartable()) {
                continue;
            }
            try {
                started.add(start(job.id(), credential));
            } catch (JobAlreadyRunningException | JobNotFoundException e) {
                LOGGER.fine(() -> "Skipped " + job.id() + ": " + e.getMessage());
            }
        }
        LOGGER.info("Started " + started.size() + " jobs");
        return started;
    }

    /**
     * The most recent retained change of every job that has one, newest first.
     */
    public List<LatestChange> latestChanges() {
        List<LatestChange> latest = new ArrayList<>();
        for (Job job : registry.list()) {
            try {
                List<ChangeRecord> recent = registry.results(job.id(), 1);
                if (!recent.isEmpty()) {
                    latest.add(new LatestChange(job.id(), job.name(), job.url(), recent.get(0)));
                }
            } catch (JobNotFoundException e) {
                LOGGER.fine(() -> "Job " + job.id() + " deleted while collecting latest changes");
            }
        }
        latest.sort(Comparator.comparing((LatestChange change) -> change.change().detectedAt()).reversed());
        return latest;
    }

    /**
     * Restores persisted jobs. With {@code resumeRunning} the jobs that were running before the
     * restart are started again, without annotation.
     */
    public List<Job> restore(boolean resumeRunning) {
        List<Job> wasRunning = registry.restore();
        if (!resumeRunning) {
            return List.of();
        }
        List<Job> resumed = new ArrayList<>();
        for (Job job : wasRunning) {
            resumed.add(start(job.id(), null));
        }
        return resumed;
    }

    public void shutdown() {
        scheduler.shutdown();
    }

    private static String validUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new JobValidationException("url must not be blank");
        }
        String trimmed = url.trim();
        try {
            URI uri = new URI(trimmed);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                throw new JobValidationException("url must use http or https: " + trimmed);
            }
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                throw new JobValidationException("url must name a host: " + trimmed);
            }
        } catch (URISyntaxException e) {
            throw new JobValidationException("url is malformed: " + trimmed);
        }
        return trimmed;
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
