package com.pagewatch.service.runtime;

import com.pagewatch.core.bus.EventBus;
import com.pagewatch.core.events.AlertRaised;
import com.pagewatch.core.events.ChangeDetected;
import com.pagewatch.core.events.CheckCompleted;
import com.pagewatch.core.events.Event;
import com.pagewatch.core.events.JobStatusChanged;
import com.pagewatch.core.model.ChangeRecord;
import com.pagewatch.core.model.Job;
import com.pagewatch.core.model.JobStatus;
import com.pagewatch.core.model.PageSnapshot;
import com.pagewatch.core.model.SystemStatus;
import com.pagewatch.monitor.api.JobStore;
import com.pagewatch.monitor.ledger.ResultLedger;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns every job, its ledger, its baseline snapshot and its worker binding. All structural
 * changes and check commits run under one lock, so a job is RUNNING exactly while a worker
 * token is bound to it.
 *
 * <p>Every transition is written to the store before it is applied in memory; a store failure
 * leaves the in-memory state untouched and propagates to the caller. Deleted ids are retired
 * through the store and reloaded on restore, so an id is never issued twice across restarts.
 */
public class JobRegistry {
    private static final Logger LOGGER = Logger.getLogger(JobRegistry.class.getName());

    private final JobStore store;
    private final EventBus eventBus;
    private final Clock clock;
    private final int ledgerCapacity;
    private final int failureThreshold;
    private final Supplier<String> idSupplier;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final Set<String> retiredIds = new HashSet<>();

    public JobRegistry(JobStore store, EventBus eventBus, Clock clock, int ledgerCapacity, int failureThreshold) {
        this(store, eventBus, clock, ledgerCapacity, failureThreshold, () -> UUID.randomUUID().toString());
    }

    JobRegistry(
            JobStore store,
            EventBus eventBus,
            Clock clock,
            int ledgerCapacity,
            int failureThreshold,
            Supplier<String> idSupplier
    ) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.idSupplier = Objects.requireNonNull(idSupplier, "idSupplier is required");
        if (ledgerCapacity < 1 || failureThreshold < 1) {
            throw new IllegalArgumentException("ledgerCapacity and failureThreshold must be positive");
        }
        this.ledgerCapacity = ledgerCapacity;
        this.failureThreshold = failureThreshold;
    }

    /**
     * Loads persisted jobs and their retained results. No worker survives a restart, so jobs that
     * were persisted as RUNNING come back STOPPED; they are returned so the caller may restart them.
     */
    public List<Job> restore() {
        List<Job> wasRunning = new ArrayList<>();
        List<Event> events = new ArrayList<>();
        lock.lock();
        try {
            retiredIds.addAll(store.loadRetiredIds());
            for (Job persisted : store.loadJobs()) {
                Job job = persisted;
                if (job.status() == JobStatus.RUNNING) {
                    job = job.withStatus(JobStatus.STOPPED);
                    store.saveJob(job);
                    wasRunning.add(job);
                    events.add(new JobStatusChanged(clock.instant(), job.id(), JobStatus.RUNNING, JobStatus.STOPPED,
                            "restored after restart"));
                }
                ResultLedger ledger = ResultLedger.restore(ledgerCapacity, store.loadResults(job.id()));
                entries.put(job.id(), new Entry(job, ledger));
            }
            LOGGER.info("Restored " + entries.size() + " jobs (" + wasRunning.size() + " were running)");
        } finally {
            lock.unlock();
        }
        events.forEach(eventBus::publish);
        return wasRunning;
    }

    public Job create(String name, String url, Duration checkInterval) {
        Job job;
        lock.lock();
        try {
            job = Job.created(nextId(), name, url, checkInterval, clock.instant());
            store.saveJob(job);
            entries.put(job.id(), new Entry(job, new ResultLedger(ledgerCapacity)));
        } finally {
            lock.unlock();
        }
        LOGGER.info("Created job " + job.id() + " for " + job.url());
        eventBus.publish(new JobStatusChanged(job.createdAt(), job.id(), null, JobStatus.CREATED, "created"));
        return job;
    }

    public Optional<Job> find(String jobId) {
        lock.lock();
        try {
            Entry entry = entries.get(jobId);
            return entry == null ? Optional.empty() : Optional.of(entry.job);
        } finally {
            lock.unlock();
        }
    }

    public Job get(String jobId) {
        return find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<Job> list() {
        lock.lock();
        try {
            return entries.values().stream().map(entry -> entry.job).toList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Transitions a startable job to RUNNING and returns the token its new worker must run under.
     * The token remembers the previous worker of the job so the new one can wait for it to finish.
     */
    public CancellationToken bindWorker(String jobId) {
        JobStatusChanged event;
        CancellationToken token;
        lock.lock();
        try {
            Entry entry = require(jobId);
            if (entry.worker != null) {
                throw new JobAlreadyRunningException(jobId);
            }
            Job running = entry.job.startedRunning();
            store.saveJob(running);
            CancellationToken previous = entry.lastWorker;
            token = new CancellationToken(jobId, previous == null || previous.isTerminated() ? null : previous);
            JobStatus before = entry.job.status();
            entry.job = running;
            entry.worker = token;
            event = new JobStatusChanged(clock.instant(), jobId, before, JobStatus.RUNNING, "started");
        } finally {
            lock.unlock();
        }
        LOGGER.info("Job " + jobId + " started");
        eventBus.publish(event);
        return token;
    }

    /**
     * Cancels the bound worker and moves the job to {@code next}. A job without a worker is returned unchanged.
     */
    public Job releaseWorker(String jobId, JobStatus next, String reason) {
        JobStatusChanged event;
        Job job;
        lock.lock();
        try {
            Entry entry = require(jobId);
            if (entry.worker == null) {
                return entry.job;
            }
            job = entry.job.withStatus(next);
            store.saveJob(job);
            entry.worker.cancel();
            entry.lastWorker = entry.worker;
            entry.worker = null;
            entry.job = job;
            event = new JobStatusChanged(clock.instant(), jobId, JobStatus.RUNNING, next, reason);
        } finally {
            lock.unlock();
        }
        LOGGER.info("Job " + jobId + " " + reason);
        eventBus.publish(event);
        return job;
    }

    public void delete(String jobId) {
        JobStatusChanged event;
        lock.lock();
        try {
            Entry entry = require(jobId);
            store.deleteJob(jobId);
            if (entry.worker != null) {
                entry.worker.cancel();
            }
            entries.remove(jobId);
            retiredIds.add(jobId);
            entry.ledger.purge();
            entry.baseline = null;
            event = new JobStatusChanged(clock.instant(), jobId, entry.job.status(), JobStatus.DELETED, "deleted");
        } finally {
            lock.unlock();
        }
        LOGGER.info("Deleted job " + jobId);
        eventBus.publish(event);
    }

    public Optional<PageSnapshot> baseline(String jobId) {
        lock.lock();
        try {
            Entry entry = entries.get(jobId);
            return entry == null ? Optional.empty() : Optional.ofNullable(entry.baseline);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies a successful check atomically: records are appended, the baseline replaced and the
     * counters advanced. Returns false, applying nothing, when {@code token} no longer owns the job.
     */
    public boolean commitCheck(
            String jobId,
            CancellationToken token,
            PageSnapshot snapshot,
            List<ChangeRecord> records,
            long durationMillis
    ) {
        List<Event> events = new ArrayList<>();
        lock.lock();
        try {
            Entry entry = entries.get(jobId);
            if (entry == null || entry.worker != token || token.isCancelled()) {
                LOGGER.fine(() -> "Dropped check result for " + jobId + "; worker no longer bound");
                return false;
            }
            Job checked = entry.job.withCheckSucceeded(clock.instant(), records.size());
            if (!records.isEmpty()) {
                store.saveResults(jobId, entry.ledger.previewAppend(records));
            }
            store.saveJob(checked);
            records.forEach(entry.ledger::append);
            entry.baseline = snapshot;
            entry.job = checked;
            events.add(new CheckCompleted(clock.instant(), jobId, entry.job.url(), true, records.size(), durationMillis));
            for (ChangeRecord record : records) {
                events.add(new ChangeDetected(record.detectedAt(), jobId, record.type(), record.description(),
                        record.annotated()));
            }
        } finally {
            lock.unlock();
        }
        LOGGER.fine(() -> "Check of " + jobId + " committed with " + records.size() + " changes");
        events.forEach(eventBus::publish);
        return true;
    }

    /**
     * Records a failed check. Returns true when the worker must halt, either because it no longer
     * owns the job or because the failure streak reached the threshold and the job moved to ERROR.
     */
    public boolean recordFailure(String jobId, CancellationToken token, String message, long durationMillis) {
        List<Event> events = new ArrayList<>();
        boolean halt;
        lock.lock();
        try {
            Entry entry = entries.get(jobId);
            if (entry == null || entry.worker != token || token.isCancelled()) {
                return true;
            }
            Job failed = entry.job.withCheckFailed(message);
            halt = failed.consecutiveFailures() >= failureThreshold;
            if (halt) {
                failed = failed.withStatus(JobStatus.ERROR);
            }
            store.saveJob(failed);
            entry.job = failed;
            events.add(new CheckCompleted(clock.instant(), jobId, failed.url(), false, 0, durationMillis));
            events.add(new AlertRaised(clock.instant(), jobId, "fetch", message,
                    Map.of("consecutiveFailures", failed.consecutiveFailures(), "url", failed.url())));
            if (halt) {
                token.cancel();
                entry.lastWorker = token;
                entry.worker = null;
                events.add(new JobStatusChanged(clock.instant(), jobId, JobStatus.RUNNING, JobStatus.ERROR,
                        failed.consecutiveFailures() + " consecutive failures"));
            }
        } finally {
            lock.unlock();
        }
        events.forEach(eventBus::publish);
        return halt;
    }

    /**
     * Moves a job to ERROR when its worker died outside the normal check path. Does nothing when
     * {@code token} was cancelled or no longer owns the job. Unlike the other transitions the
     * in-memory release is applied even if the store cannot be written, so the job never stays
     * RUNNING without a live worker.
     */
    public void abandonWorker(String jobId, CancellationToken token, String message) {
        List<Event> events = new ArrayList<>();
        Job errored;
        lock.lock();
        try {
            Entry entry = entries.get(jobId);
            if (entry == null || entry.worker != token || token.isCancelled()) {
                return;
            }
            token.cancel();
            entry.lastWorker = token;
            entry.worker = null;
            entry.job = entry.job.withError(message);
            errored = entry.job;
            try {
                store.saveJob(errored);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Failed persisting ERROR status of " + jobId, e);
            }
            events.add(new AlertRaised(clock.instant(), jobId, "worker", message, Map.of("url", errored.url())));
            events.add(new JobStatusChanged(clock.instant(), jobId, JobStatus.RUNNING, JobStatus.ERROR, message));
        } finally {
            lock.unlock();
        }
        LOGGER.warning("Job " + jobId + " moved to ERROR: " + message);
        events.forEach(eventBus::publish);
    }

    public List<ChangeRecord> results(String jobId, int limit) {
        lock.lock();
        try {
            return require(jobId).ledger.recent(limit);
        } finally {
            lock.unlock();
        }
    }

    public List<ChangeRecord> allResults(String jobId) {
        lock.lock();
        try {
            return require(jobId).ledger.all();
        } finally {
            lock.unlock();
        }
    }

    public SystemStatus systemStatus() {
        lock.lock();
        try {
            Map<JobStatus, Integer> byStatus = new EnumMap<>(JobStatus.class);
            for (Entry entry : entries.values()) {
                byStatus.merge(entry.job.status(), 1, Integer::sum);
            }
            return new SystemStatus(entries.size(), byStatus);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels every bound worker without touching job status, so RUNNING jobs stay RUNNING in storage.
     */
    public List<CancellationToken> cancelWorkersForShutdown() {
        lock.lock();
        try {
            List<CancellationToken> cancelled = new ArrayList<>();
            for (Entry entry : entries.values()) {
                if (entry.worker != null) {
                    entry.worker.cancel();
                    cancelled.add(entry.worker);
                }
            }
            return cancelled;
        } finally {
            lock.unlock();
        }
    }

    private Entry require(String jobId) {
        Entry entry = entries.get(jobId);
        if (entry == null) {
            throw new JobNotFoundException(jobId);
        }
        return entry;
    }

    private String nextId() {
        String id = idSupplier.get();
        while (entries.containsKey(id) || retiredIds.contains(id)) {
            LOGGER.warning("Generated job id " + id + " was already issued; generating another");
            id = idSupplier.get();
        }
        return id;
    }

    private static final class Entry {
        private Job job;
        private final ResultLedger ledger;
        private PageSnapshot baseline;
        private CancellationToken worker;
        private CancellationToken lastWorker;

        private Entry(Job job, ResultLedger ledger) {
            this.job = job;
            this.ledger = ledger;
        }
    }
}
