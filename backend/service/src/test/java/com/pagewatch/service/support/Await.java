package com.pagewatch.service.support;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

public final class Await {
    private Await() {
    }

    public static void until(String description, BooleanSupplier condition) throws InterruptedException {
        until(description, condition, Duration.ofSeconds(5));
    }

    public static void until(String description, BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting for " + description);
            }
            Thread.sleep(10);
        }
    }
}
