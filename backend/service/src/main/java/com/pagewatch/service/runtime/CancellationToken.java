package com.pagewatch.service.runtime;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Binds one worker run to its job. Cancelling sets the flag, releases any interval wait and
 * interrupts the attached thread so a blocking fetch returns early.
 */
public final class CancellationToken {
    private final String jobId;
    private volatile CancellationToken predecessor;
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private Thread runner;

    CancellationToken(String jobId, CancellationToken predecessor) {
        this.jobId = jobId;
        this.predecessor = predecessor;
    }

    public String jobId() {
        return jobId;
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public synchronized void cancel() {
        if (isCancelled()) {
            return;
        }
        cancelled.countDown();
        if (runner != null && runner != Thread.currentThread()) {
            runner.interrupt();
        }
    }

    synchronized void attach(Thread thread) {
        runner = thread;
        if (isCancelled()) {
            thread.interrupt();
        }
    }

    /**
     * Called by the runner itself; clears any interrupt aimed at this run so a pooled thread starts clean.
     */
    synchronized void detach() {
        runner = null;
        Thread.interrupted();
    }

    /**
     * Waits up to {@code timeout}; returns true if the token was cancelled meanwhile.
     */
    boolean awaitCancellation(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    void awaitPredecessor() throws InterruptedException {
        CancellationToken previous = predecessor;
        if (previous != null) {
            previous.terminated.await();
            predecessor = null;
        }
    }

    /**
     * Waits for the predecessor even if this run is cancelled meanwhile. A run that exits early must
     * not report termination before the run it replaced has finished, or the next run would overlap it.
     */
    void awaitPredecessorUninterruptibly() {
        CancellationToken previous = predecessor;
        if (previous == null) {
            return;
        }
        boolean interrupted = false;
        while (true) {
            try {
                previous.terminated.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        predecessor = null;
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    void markTerminated() {
        terminated.countDown();
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isTerminated() {
        return terminated.getCount() == 0;
    }
}
