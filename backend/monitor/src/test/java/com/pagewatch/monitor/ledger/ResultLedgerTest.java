package com.pagewatch.monitor.ledger;

import com.pagewatch.core.model.ChangeDetails;
import com.pagewatch.core.model.ChangeRecord;
import com.pagewatch.core.model.ChangeType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultLedgerTest {
    private static final Instant BASE = Instant.parse("2026-03-01T00:00:00Z");

    @Test
    void evictsOldestRecordAtCapacity() {
        ResultLedger ledger = new ResultLedger(3);
        IntStream.range(0, 5).forEach(i -> ledger.append(record(i)));

        assertEquals(3, ledger.size());
        assertEquals(List.of("change 2", "change 3", "change 4"), descriptions(ledger.all()));
    }

    @Test
    void previewAppendEvictsWithoutTouchingLedger() {
        ResultLedger ledger = new ResultLedger(3);
        IntStream.range(0, 2).forEach(i -> ledger.append(record(i)));

        List<ChangeRecord> preview = ledger.previewAppend(List.of(record(2), record(3)));

        assertEquals(List.of("change 1", "change 2", "change 3"), descriptions(preview));
        assertEquals(List.of("change 0", "change 1"), descriptions(ledger.all()));
    }

    @Test
    void recentReturnsMostRecentFirstUpToLimit() {
        ResultLedger ledger = new ResultLedger(10);
        IntStream.range(0, 4).forEach(i -> ledger.append(record(i)));

        assertEquals(List.of("change 3", "change 2"), descriptions(ledger.recent(2)));
        assertEquals(4, ledger.recent(50).size());
        assertTrue(ledger.recent(0).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> ledger.recent(-1));
    }

    @Test
    void returnedListsAreDetachedCopies() {
        ResultLedger ledger = new ResultLedger(10);
        ledger.append(record(0));
        List<ChangeRecord> snapshot = ledger.all();

        ledger.append(record(1));

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(record(2)));
    }

    @Test
    void restoreKeepsOnlyTheNewestRecordsWithinCapacity() {
        List<ChangeRecord> persisted = IntStream.range(0, 6).mapToObj(ResultLedgerTest::record).toList();

        ResultLedger ledger = ResultLedger.restore(4, persisted);

        assertEquals(List.of("change 2", "change 3", "change 4", "change 5"), descriptions(ledger.all()));
    }

    @Test
    void purgedLedgerRejectsAppends() {
        ResultLedger ledger = new ResultLedger(5);
        ledger.append(record(0));

        ledger.purge();

        assertEquals(0, ledger.size());
        assertThrows(IllegalStateException.class, () -> ledger.append(record(1)));
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ResultLedger(0));
    }

    @Test
    void concurrentAppendsNeverExceedCapacity() throws Exception {
        ResultLedger ledger = new ResultLedger(50);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            Future<?>[] tasks = new Future<?>[4];
            for (int t = 0; t < tasks.length; t++) {
                tasks[t] = executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 500; i++) {
                        ledger.append(record(i));
                        assertTrue(ledger.size() <= 50);
                    }
                    return null;
                });
            }
            start.countDown();
            for (Future<?> task : tasks) {
                task.get();
            }
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        }

        assertEquals(50, ledger.size());
    }

    private static ChangeRecord record(int index) {
        return new ChangeRecord(ChangeType.TEXT_CHANGE, "change " + index, ChangeDetails.ofText(List.of()), null,
                BASE.plusSeconds(index));
    }

    private static List<String> descriptions(List<ChangeRecord> records) {
        return records.stream().map(ChangeRecord::description).toList();
    }
}
