package com.pagewatch.service.support;

import com.pagewatch.core.model.PageSnapshot;
import com.pagewatch.monitor.api.PageFetcher;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Takes a fixed time per fetch and ignores interruption, like a client stuck in a blocking read.
 * Tracks how many fetches run at the same time.
 */
public class SlowPageFetcher implements PageFetcher {
    private final PageSnapshot snapshot;
    private final Duration latency;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final AtomicInteger calls = new AtomicInteger();

    public SlowPageFetcher(PageSnapshot snapshot, Duration latency) {
        this.snapshot = snapshot;
        this.latency = latency;
    }

    @Override
    public PageSnapshot fetch(String url, Duration timeout) {
        calls.incrementAndGet();
        maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
        try {
            sleepIgnoringInterrupts();
            return snapshot;
        } finally {
            inFlight.decrementAndGet();
        }
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int maxInFlight() {
        return maxInFlight.get();
    }

    public int calls() {
        return calls.get();
    }

    private void sleepIgnoringInterrupts() {
        long deadline = System.nanoTime() + latency.toNanos();
        boolean interrupted = false;
        long remaining;
        while ((remaining = deadline - System.nanoTime()) > 0) {
            try {
                Thread.sleep(Math.max(1, remaining / 1_000_000));
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
