package com.pagewatch.monitor.ledger;

import com.pagewatch.core.model.ChangeRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO of the change records retained for one job. The oldest record is evicted once
 * the ledger is full.
 */
public class ResultLedger {
    private final int capacity;
    private final ArrayDeque<ChangeRecord> records;
    private final ReentrantLock lock = new ReentrantLock();
    private boolean purged;

    public ResultLedger(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.records = new ArrayDeque<>(Math.min(capacity, 64));
    }

    public static ResultLedger restore(int capacity, List<ChangeRecord> oldestFirst) {
        ResultLedger ledger = new ResultLedger(capacity);
        oldestFirst.forEach(ledger::append);
        return ledger;
    }

    public void append(ChangeRecord record) {
        lock.lock();
        try {
            if (purged) {
                throw new IllegalStateException("Ledger has been purged");
            }
            if (records.size() == capacity) {
                records.pollFirst();
            }
            records.addLast(record);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Up to {@code limit} records, most recent first.
     */
    public List<ChangeRecord> recent(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        lock.lock();
        try {
            List<ChangeRecord> out = new ArrayList<>(Math.min(limit, records.size()));
            Iterator<ChangeRecord> newestFirst = records.descendingIterator();
            while (newestFirst.hasNext() && out.size() < limit) {
                out.add(newestFirst.next());
            }
            return Collections.unmodifiableList(out);
        } finally {
            lock.unlock();
        }
    }

    public List<ChangeRecord> all() {
        lock.lock();
        try {
            return List.copyOf(records);
        } finally {
            lock.unlock();
        }
    }

    /**
     * The records, oldest first, that the ledger would hold after appending {@code more}. The
     * ledger itself is not changed, so callers can persist the outcome before applying it.
     */
    public List<ChangeRecord> previewAppend(List<ChangeRecord> more) {
        lock.lock();
        try {
            ArrayDeque<ChangeRecord> preview = new ArrayDeque<>(records);
            for (ChangeRecord record : more) {
                if (preview.size() == capacity) {
                    preview.pollFirst();
                }
                preview.addLast(record);
            }
            return List.copyOf(preview);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public void purge() {
        lock.lock();
        try {
            records.clear();
            purged = true;
        } finally {
            lock.unlock();
        }
    }
}
