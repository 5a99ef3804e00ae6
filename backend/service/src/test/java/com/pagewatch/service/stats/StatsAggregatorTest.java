package com.pagewatch.service.stats;

import com.pagewatch.core.model.Annotation;
import com.pagewatch.core.model.ChangeRecord;
import com.pagewatch.core.model.ChangeType;
import com.pagewatch.core.model.DetectedEntity;
import com.pagewatch.core.model.Job;
import com.pagewatch.core.model.JobStats;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StatsAggregatorTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void aggregatesRetainedRecordsAndJobCounters() {
        Job job = Job.created("j-1", "Acme", "https://acme.example", Duration.ofMinutes(5), NOW)
                .withCheckSucceeded(NOW, 0)
                .withCheckSucceeded(NOW.plusSeconds(60), 3)
                .withCheckFailed("timed out");
        List<ChangeRecord> retained = List.of(
                record(ChangeType.TEXT_CHANGE, null),
                record(ChangeType.NEW_IMAGES, annotation(true, "Globex Industries", "Initech")),
                record(ChangeType.NEW_IMAGES, annotation(false, "Initech")),
                record(ChangeType.REMOVED_LINKS, annotation(true, " Globex Industries "))
        );

        JobStats stats = StatsAggregator.aggregate(job, retained);

        assertEquals(2, stats.totalChecks());
        assertEquals(3, stats.changesDetected());
        assertEquals(1, stats.failedChecks());
        assertEquals("timed out", stats.lastError());
        assertEquals(4, stats.retainedChanges());
        assertEquals(List.of("new_images", "removed_links", "text_change"), List.copyOf(stats.changeTypes().keySet()));
        assertEquals(Map.of("new_images", 2L, "removed_links", 1L, "text_change", 1L), stats.changeTypes());
        assertEquals(3, stats.annotatedChanges());
        assertEquals(2, stats.notableDetections());
        assertEquals(List.of("Globex Industries", "Initech"), stats.entitiesDetected());
    }

    @Test
    void emptyLedgerYieldsZeroedFigures() {
        Job job = Job.created("j-1", "Acme", "https://acme.example", Duration.ofMinutes(5), NOW);

        JobStats stats = StatsAggregator.aggregate(job, List.of());

        assertEquals(0, stats.retainedChanges());
        assertTrue(stats.changeTypes().isEmpty());
        assertTrue(stats.entitiesDetected().isEmpty());
        assertEquals(0, stats.annotatedChanges());
    }

    private static ChangeRecord record(ChangeType type, Annotation annotation) {
        return new ChangeRecord(type, type.tag(), null, annotation, NOW);
    }

    private static Annotation annotation(boolean notable, String... names) {
        List<DetectedEntity> entities = java.util.Arrays.stream(names)
                .map(name -> new DetectedEntity(name, "company", "high", "", "image alt"))
                .toList();
        return new Annotation(notable, entities, null, null, null, "summary");
    }
}
