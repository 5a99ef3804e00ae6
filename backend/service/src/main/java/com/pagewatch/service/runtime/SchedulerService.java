package com.pagewatch.service.runtime;

import com.pagewatch.monitor.annotation.AnnotationPort;
import com.pagewatch.monitor.api.PageFetcher;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Runs one worker per running job on a cached pool of daemon threads.
 */
public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());

    private final JobRegistry registry;
    private final PageFetcher fetcher;
    private final Clock clock;
    private final Duration fetchTimeout;
    private final ExecutorService workerExecutor = Executors.newCachedThreadPool(new WorkerThreadFactory());

    public SchedulerService(JobRegistry registry, PageFetcher fetcher, Clock clock, Duration fetchTimeout) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.fetchTimeout = Objects.requireNonNull(fetchTimeout, "fetchTimeout is required");
    }

    public void launch(CancellationToken token, AnnotationPort annotationPort) {
        workerExecutor.execute(new JobWorker(
                token.jobId(),
                token,
                registry,
                fetcher,
                annotationPort,
                clock,
                fetchTimeout
        ));
        LOGGER.fine(() -> "Launched worker for " + token.jobId()
                + (annotationPort.enabled() ? " with annotation" : " without annotation"));
    }

    public void shutdown() {
        List<CancellationToken> cancelled = registry.cancelWorkersForShutdown();
        workerExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warning("Workers still running after shutdown timeout: " + cancelled.stream()
                        .filter(token -> !token.isTerminated())
                        .map(CancellationToken::jobId)
                        .toList());
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "pagewatch-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
