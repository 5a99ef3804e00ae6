package com.pagewatch.service.runtime;

import com.pagewatch.core.diff.SnapshotDiffer;
import com.pagewatch.core.model.ChangeRecord;
import com.pagewatch.core.model.Job;
import com.pagewatch.core.model.PageSnapshot;
import com.pagewatch.monitor.annotation.AnnotationPort;
import com.pagewatch.monitor.api.FetchException;
import com.pagewatch.monitor.api.PageFetcher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Check loop of one job: fetch, diff against the baseline, annotate, commit, then wait for the
 * job's interval. The loop ends when its token is cancelled or the registry halts it.
 */
final class JobWorker implements Runnable {
    private static final Logger LOGGER = Logger.getLogger(JobWorker.class.getName());

    private final String jobId;
    private final CancellationToken token;
    private final JobRegistry registry;
    private final PageFetcher fetcher;
    private final AnnotationPort annotationPort;
    private final Clock clock;
    private final Duration fetchTimeout;

    JobWorker(
            String jobId,
            CancellationToken token,
            JobRegistry registry,
            PageFetcher fetcher,
            AnnotationPort annotationPort,
            Clock clock,
            Duration fetchTimeout
    ) {
        this.jobId = jobId;
        this.token = token;
        this.registry = registry;
        this.fetcher = fetcher;
        this.annotationPort = annotationPort;
        this.clock = clock;
        this.fetchTimeout = fetchTimeout;
    }

    @Override
    public void run() {
        token.attach(Thread.currentThread());
        try {
            token.awaitPredecessor();
            while (!token.isCancelled()) {
                Optional<Job> job = registry.find(jobId);
                if (job.isEmpty()) {
                    break;
                }
                if (runCheck(job.get())) {
                    break;
                }
                if (token.awaitCancellation(job.get().checkInterval())) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            LOGGER.fine(() -> "Worker for " + jobId + " interrupted");
        } catch (RuntimeException | Error e) {
            LOGGER.log(Level.SEVERE, "Worker for " + jobId + " crashed", e);
            registry.abandonWorker(jobId, token, "Worker crashed: " + describe(e));
            throw e;
        } finally {
            token.awaitPredecessorUninterruptibly();
            token.detach();
            token.markTerminated();
            LOGGER.fine(() -> "Worker for " + jobId + " finished");
        }
    }

    /**
     * Runs one check. Returns true when the worker must stop.
     */
    private boolean runCheck(Job job) throws InterruptedException {
        Instant startedAt = clock.instant();
        try {
            PageSnapshot snapshot = fetcher.fetch(job.url(), fetchTimeout);
            if (token.isCancelled()) {
                return true;
            }
            PageSnapshot baseline = registry.baseline(jobId).orElse(null);
            List<ChangeRecord> records = new ArrayList<>();
            for (ChangeRecord record : SnapshotDiffer.diff(baseline, snapshot)) {
                records.add(annotationPort.annotate(record).map(record::withAnnotation).orElse(record));
                if (token.isCancelled()) {
                    return true;
                }
            }
            if (token.isCancelled()) {
                return true;
            }
            return !registry.commitCheck(jobId, token, snapshot, records, elapsedMillis(startedAt));
        } catch (FetchException e) {
            LOGGER.warning("Check of " + jobId + " failed (" + e.kind() + "): " + e.getMessage());
            return registry.recordFailure(jobId, token, e.getMessage(), elapsedMillis(startedAt));
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Check of " + jobId + " failed unexpectedly", e);
            return registry.recordFailure(jobId, token, describe(e), elapsedMillis(startedAt));
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private long elapsedMillis(Instant startedAt) {
        return Math.max(0, Duration.between(startedAt, clock.instant()).toMillis());
    }
}
