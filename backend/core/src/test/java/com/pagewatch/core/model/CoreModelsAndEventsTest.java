package com.pagewatch.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagewatch.core.events.AlertRaised;
import com.pagewatch.core.events.ChangeDetected;
import com.pagewatch.core.events.CheckCompleted;
import com.pagewatch.core.events.JobStatusChanged;
import com.pagewatch.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoreModelsAndEventsTest {
    private static final Instant NOW = Instant.parse("2026-02-01T00:00:00Z");

    @Test
    void jobCountersFollowCheckOutcomes() {
        Job job = Job.created("job-1", "Portfolio", "https://example.com", Duration.ofMinutes(5), NOW)
                .withStatus(JobStatus.RUNNING);

        Job failed = job.withCheckFailed("connection refused").withCheckFailed("connection refused");
        assertEquals(2, failed.failedChecks());
        assertEquals(2, failed.consecutiveFailures());
        assertEquals(0, failed.totalChecks());
        assertNull(failed.lastCheck());
        assertEquals("connection refused", failed.lastError());

        Job recovered = failed.withCheckSucceeded(NOW.plusSeconds(60), 3);
        assertEquals(1, recovered.totalChecks());
        assertEquals(3, recovered.changesDetected());
        assertEquals(2, recovered.failedChecks());
        assertEquals(0, recovered.consecutiveFailures());
        assertNull(recovered.lastError());
        assertEquals(NOW.plusSeconds(60), recovered.lastCheck());
        assertTrue(recovered.isRunning());
    }

    @Test
    void jobRequiresIdentityFields() {
        assertThrows(NullPointerException.class,
                () -> Job.created(null, "n", "https://example.com", Duration.ofMinutes(1), NOW));
        assertThrows(NullPointerException.class,
                () -> Job.created("id", "n", "https://example.com", null, NOW));
    }

    @Test
    void jobJsonDoesNotCarryDerivedProperties() throws Exception {
        ObjectMapper mapper = JsonUtils.objectMapper();
        Job job = Job.created("job-1", "Portfolio", "https://example.com", Duration.ofMinutes(5), NOW);

        JsonNode tree = mapper.readTree(mapper.writeValueAsString(job));

        assertFalse(tree.has("running"));
        assertEquals("PT5M", tree.get("checkInterval").asText());
        assertEquals(job, mapper.readValue(mapper.writeValueAsString(job), Job.class));
    }

    @Test
    void startableStatesExcludeRunningAndDeleted() {
        assertTrue(JobStatus.CREATED.isStartable());
        assertTrue(JobStatus.PAUSED.isStartable());
        assertTrue(JobStatus.STOPPED.isStartable());
        assertTrue(JobStatus.ERROR.isStartable());
        assertFalse(JobStatus.RUNNING.isStartable());
        assertFalse(JobStatus.DELETED.isStartable());
    }

    @Test
    void imageKeyCombinesIdentifiersAndTruncatesAlt() {
        String longAlt = "A".repeat(60);
        ImageDescriptor image = new ImageDescriptor("/logo.png", longAlt, "", "7", "main-logo", "", "");

        assertEquals("src:/logo.png | data-id:7 | id:main-logo | alt:" + "A".repeat(50), image.key());
        assertEquals("No additional context", ImageDescriptor.of("/x.png", null).context());
        assertEquals("Alt: 'Acme' | Caption: 'Seed stage'",
                new ImageDescriptor("/a.png", "Acme", null, null, null, null, "Seed stage").context());
    }

    @Test
    void snapshotHashIgnoresFetchTimeButTracksContent() {
        PageSnapshot first = PageSnapshot.of("https://example.com", "T", List.of("Paragraph one"),
                List.of(ImageDescriptor.of("/a.png", "A")), List.of(), List.of("H1:Top"), NOW);
        PageSnapshot sameContent = PageSnapshot.of("https://example.com", "T", List.of("Paragraph one"),
                List.of(ImageDescriptor.of("/a.png", "A")), List.of(), List.of("H1:Top"), NOW.plusSeconds(60));
        PageSnapshot changed = PageSnapshot.of("https://example.com", "T", List.of("Paragraph two"),
                List.of(ImageDescriptor.of("/a.png", "A")), List.of(), List.of("H1:Top"), NOW);

        assertEquals(first.contentHash(), sameContent.contentHash());
        assertFalse(first.contentHash().equals(changed.contentHash()));
    }

    @Test
    void changeTypeUsesWireTags() throws Exception {
        ObjectMapper mapper = JsonUtils.objectMapper();

        assertEquals("\"new_images\"", mapper.writeValueAsString(ChangeType.NEW_IMAGES));
        assertEquals(ChangeType.TEXT_CHANGE, mapper.readValue("\"text_change\"", ChangeType.class));
        assertThrows(IllegalArgumentException.class, () -> ChangeType.fromTag("portfolio_change"));
    }

    @Test
    void changeRecordRoundTripsWithAnnotation() throws Exception {
        ObjectMapper mapper = JsonUtils.objectMapper();
        ChangeRecord record = new ChangeRecord(ChangeType.NEW_IMAGES, "1 new images found",
                ChangeDetails.ofImages(List.of(ImageDescriptor.of("/acme.png", "Acme"))), null, NOW);
        Annotation annotation = new Annotation(true,
                List.of(new DetectedEntity("Acme", "Robotics", "high", "logo alt text", "image")),
                "Acme", null, null, "Acme added to the page");

        ChangeRecord annotated = record.withAnnotation(annotation);
        JsonNode tree = mapper.readTree(mapper.writeValueAsString(annotated));

        assertFalse(record.annotated());
        assertTrue(annotated.annotated());
        assertFalse(tree.get("details").has("links"));
        assertEquals("new_images", tree.get("type").asText());
        assertEquals(annotated, mapper.readValue(mapper.writeValueAsString(annotated), ChangeRecord.class));
    }

    @Test
    void systemStatusCountsMissingStatusesAsZero() {
        SystemStatus status = new SystemStatus(3, Map.of(JobStatus.RUNNING, 2, JobStatus.ERROR, 1));

        assertEquals(2, status.count(JobStatus.RUNNING));
        assertEquals(0, status.count(JobStatus.PAUSED));
    }

    @Test
    void eventsExposeTypeAndPayload() {
        JobStatusChanged statusChanged = new JobStatusChanged(NOW, "job-1", JobStatus.CREATED, JobStatus.RUNNING, "start");
        CheckCompleted completed = new CheckCompleted(NOW, "job-1", "https://example.com", true, 2, 100);
        ChangeDetected detected = new ChangeDetected(NOW, "job-1", ChangeType.NEW_LINKS, "1 new links found", false);
        AlertRaised alert = new AlertRaised(NOW, "job-1", "fetch", "timeout", Map.of("attempt", 3));

        assertEquals("JobStatusChanged", statusChanged.type());
        assertEquals("CheckCompleted", completed.type());
        assertEquals("ChangeDetected", detected.type());
        assertEquals("AlertRaised", alert.type());
        assertEquals(JobStatus.RUNNING, statusChanged.current());
        assertEquals(2, completed.changeCount());
        assertEquals(ChangeType.NEW_LINKS, detected.changeType());
        assertEquals(3, alert.details().get("attempt"));
    }
}
