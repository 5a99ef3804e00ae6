package com.pagewatch.service.store;

import com.pagewatch.core.events.Event;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Append-only journal of engine events. Once the journal reaches {@code maxBytes} it is rolled to
 * {@code <file>.1}, replacing the previous roll, so at most two segments exist on disk. Queries
 * read the current segment only; they serve tests and operator tooling, not the engine itself.
 */
public class JsonlEventStore implements EventStore {
    private static final Logger LOGGER = Logger.getLogger(JsonlEventStore.class.getName());
    static final long DEFAULT_MAX_BYTES = 10L * 1024 * 1024;

    private final Path file;
    private final Path rolled;
    private final long maxBytes;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlEventStore(Path file) {
        this(file, DEFAULT_MAX_BYTES);
    }

    public JsonlEventStore(Path file, long maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        this.file = file;
        this.rolled = file.resolveSibling(file.getFileName() + ".1");
        this.maxBytes = maxBytes;
    }

    @Override
    public void append(Event event) {
        String line = EventCodec.toJsonLine(event);
        lock.lock();
        try {
            Files.createDirectories(file.getParent());
            rollIfFull();
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending event to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void rollIfFull() throws IOException {
        if (Files.exists(file) && Files.size(file) >= maxBytes) {
            Files.move(file, rolled, StandardCopyOption.REPLACE_EXISTING);
            LOGGER.info("Rolled event journal " + file + " to " + rolled);
        }
    }

    /**
     * Events at or after {@code since}, optionally of one type.
     */
    @Override
    public List<Event> query(Instant since, Optional<String> type, int limit) {
        return select(event -> !event.timestamp().isBefore(since)
                && type.map(value -> value.equals(event.type())).orElse(true), limit);
    }

    @Override
    public List<Event> history(String jobId, int limit) {
        return select(event -> jobId.equals(event.jobId()), limit);
    }

    private List<Event> select(Predicate<Event> filter, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            List<Event> events = new ArrayList<>();
            int lineNumber = 0;
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                Event event;
                try {
                    event = EventCodec.fromJsonLine(line);
                } catch (RuntimeException decodeError) {
                    throw new IllegalStateException("Invalid JSONL event at line " + lineNumber + " of " + file, decodeError);
                }
                if (filter.test(event)) {
                    events.add(event);
                }
            }
            if (events.size() <= limit) {
                return events;
            }
            return List.copyOf(events.subList(events.size() - limit, events.size()));
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading events from " + file, e);
        } finally {
            lock.unlock();
        }
    }
}
