package com.pagewatch.core.diff;

import com.pagewatch.core.model.ChangeDetails;
import com.pagewatch.core.model.ChangeRecord;
import com.pagewatch.core.model.ChangeType;
import com.pagewatch.core.model.ImageDescriptor;
import com.pagewatch.core.model.LinkDescriptor;
import com.pagewatch.core.model.PageSnapshot;
import com.pagewatch.core.model.TextDelta;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Compares two snapshots of the same page. Facets are evaluated in a fixed order (images, links,
 * text, structure) and each facet contributes at most one record per change type.
 */
public final class SnapshotDiffer {
    static final int MIN_PARAGRAPH_LENGTH = 20;
    static final int MAX_DELTA_LENGTH = 200;
    private static final int EXAMPLE_LENGTH = 50;
    private static final int EXAMPLE_COUNT = 3;

    private SnapshotDiffer() {
    }

    public static List<ChangeRecord> diff(PageSnapshot previous, PageSnapshot current) {
        if (previous == null || previous.contentHash().equals(current.contentHash())) {
            return List.of();
        }
        Instant detectedAt = current.fetchedAt();
        List<ChangeRecord> records = new ArrayList<>();
        diffImages(previous, current, detectedAt, records);
        diffLinks(previous, current, detectedAt, records);
        diffText(previous, current, detectedAt, records);
        diffStructure(previous, current, detectedAt, records);
        return List.copyOf(records);
    }

    private static void diffImages(PageSnapshot previous, PageSnapshot current, Instant at, List<ChangeRecord> out) {
        Map<String, ImageDescriptor> before = index(previous.images(), ImageDescriptor::key);
        Map<String, ImageDescriptor> after = index(current.images(), ImageDescriptor::key);

        List<ImageDescriptor> added = after.entrySet().stream()
                .filter(entry -> !before.containsKey(entry.getKey()))
                .map(Map.Entry::getValue)
                .filter(image -> !isNavigationImage(image))
                .toList();
        if (!added.isEmpty()) {
            out.add(new ChangeRecord(ChangeType.NEW_IMAGES,
                    withExamples(added.size() + " new images found", altsOf(added)),
                    ChangeDetails.ofImages(added), null, at));
        }

        List<ImageDescriptor> removed = before.entrySet().stream()
                .filter(entry -> !after.containsKey(entry.getKey()))
                .map(Map.Entry::getValue)
                .filter(image -> !isNavigationImage(image))
                .toList();
        if (!removed.isEmpty()) {
            out.add(new ChangeRecord(ChangeType.REMOVED_IMAGES,
                    withExamples(removed.size() + " images removed", altsOf(removed)),
                    ChangeDetails.ofImages(removed), null, at));
        }

        List<ImageDescriptor> modified = new ArrayList<>();
        Set<String> changedAttributes = new LinkedHashSet<>();
        for (Map.Entry<String, ImageDescriptor> entry : after.entrySet()) {
            ImageDescriptor old = before.get(entry.getKey());
            ImageDescriptor now = entry.getValue();
            if (old == null || isNavigationImage(old) || isNavigationImage(now)) {
                continue;
            }
            List<String> changes = changedAttributes(old, now);
            if (!changes.isEmpty()) {
                modified.add(now);
                changedAttributes.addAll(changes);
            }
        }
        if (!modified.isEmpty()) {
            out.add(new ChangeRecord(ChangeType.MODIFIED_IMAGES,
                    modified.size() + " images modified | Changed attributes: " + String.join(", ", changedAttributes),
                    ChangeDetails.ofModifiedImages(modified, List.copyOf(changedAttributes)), null, at));
        }
    }

    private static void diffLinks(PageSnapshot previous, PageSnapshot current, Instant at, List<ChangeRecord> out) {
        Map<String, LinkDescriptor> before = index(previous.links(), LinkDescriptor::key);
        Map<String, LinkDescriptor> after = index(current.links(), LinkDescriptor::key);

        List<LinkDescriptor> added = after.entrySet().stream()
                .filter(entry -> !before.containsKey(entry.getKey()))
                .map(Map.Entry::getValue)
                .filter(link -> !NavigationFilter.isNavigation(link.text()))
                .toList();
        if (!added.isEmpty()) {
            out.add(new ChangeRecord(ChangeType.NEW_LINKS, added.size() + " new links found",
                    ChangeDetails.ofLinks(added), null, at));
        }

        List<LinkDescriptor> removedCandidates = before.entrySet().stream()
                .filter(entry -> !after.containsKey(entry.getKey()))
                .map(Map.Entry::getValue)
                .toList();
        List<LinkDescriptor> removed = removedCandidates.stream()
                .filter(link -> !NavigationFilter.isNavigation(link.text()))
                .toList();
        if (!removed.isEmpty()) {
            String description = withExamples(removed.size() + " links removed",
                    removed.stream().map(LinkDescriptor::text).toList());
            int filtered = removedCandidates.size() - removed.size();
            if (filtered > 0) {
                description += " | (" + filtered + " navigation links filtered)";
            }
            out.add(new ChangeRecord(ChangeType.REMOVED_LINKS, description,
                    ChangeDetails.ofLinks(removed), null, at));
        }
    }

    private static void diffText(PageSnapshot previous, PageSnapshot current, Instant at, List<ChangeRecord> out) {
        List<TextDelta> deltas = ParagraphDiff.diff(previous.paragraphs(), current.paragraphs()).stream()
                .filter(delta -> delta.content().trim().length() >= MIN_PARAGRAPH_LENGTH)
                .filter(delta -> !NavigationFilter.isNavigation(delta.content()))
                .map(delta -> new TextDelta(delta.kind(), truncate(delta.content(), MAX_DELTA_LENGTH), delta.position()))
                .toList();
        if (deltas.isEmpty()) {
            return;
        }
        List<String> addedExamples = examplesOf(deltas, TextDelta.Kind.ADDED);
        List<String> removedExamples = examplesOf(deltas, TextDelta.Kind.REMOVED);
        StringBuilder description = new StringBuilder("Text content changed - ")
                .append(countOf(deltas, TextDelta.Kind.ADDED)).append(" additions, ")
                .append(countOf(deltas, TextDelta.Kind.REMOVED)).append(" removals");
        if (!addedExamples.isEmpty()) {
            description.append(" | Added examples: ").append(String.join(" | ", addedExamples));
        }
        if (!removedExamples.isEmpty()) {
            description.append(" | Removed examples: ").append(String.join(" | ", removedExamples));
        }
        out.add(new ChangeRecord(ChangeType.TEXT_CHANGE, description.toString(), ChangeDetails.ofText(deltas), null, at));
    }

    private static void diffStructure(PageSnapshot previous, PageSnapshot current, Instant at, List<ChangeRecord> out) {
        Set<String> before = new LinkedHashSet<>(previous.headings());
        Set<String> after = new LinkedHashSet<>(current.headings());
        List<String> added = after.stream().filter(marker -> !before.contains(marker)).toList();
        List<String> removed = before.stream().filter(marker -> !after.contains(marker)).toList();
        if (added.isEmpty() && removed.isEmpty()) {
            return;
        }
        out.add(new ChangeRecord(ChangeType.STRUCTURE_CHANGE,
                "Page structure changed - " + added.size() + " headings added, " + removed.size() + " headings removed",
                ChangeDetails.ofStructure(added, removed), null, at));
    }

    private static <T> Map<String, T> index(List<T> items, Function<T, String> key) {
        Map<String, T> indexed = new LinkedHashMap<>();
        for (T item : items) {
            indexed.putIfAbsent(key.apply(item), item);
        }
        return indexed;
    }

    private static boolean isNavigationImage(ImageDescriptor image) {
        return NavigationFilter.isNavigation(image.alt()) || NavigationFilter.isNavigation(image.title());
    }

    private static List<String> changedAttributes(ImageDescriptor old, ImageDescriptor now) {
        List<String> changes = new ArrayList<>();
        if (!old.alt().equals(now.alt())) {
            changes.add("alt");
        }
        if (!old.title().equals(now.title())) {
            changes.add("title");
        }
        if (!old.dataId().equals(now.dataId())) {
            changes.add("data-id");
        }
        if (!old.elementId().equals(now.elementId())) {
            changes.add("id");
        }
        if (!old.ariaLabel().equals(now.ariaLabel())) {
            changes.add("aria-label");
        }
        if (!old.caption().equals(now.caption())) {
            changes.add("data-caption");
        }
        return changes;
    }

    private static List<String> altsOf(List<ImageDescriptor> images) {
        return images.stream().map(ImageDescriptor::alt).toList();
    }

    private static String withExamples(String headline, List<String> candidates) {
        List<String> examples = candidates.stream()
                .filter(value -> !value.isBlank())
                .limit(EXAMPLE_COUNT)
                .map(value -> truncate(value, EXAMPLE_LENGTH))
                .toList();
        return examples.isEmpty() ? headline : headline + " | Examples: " + String.join(", ", examples);
    }

    private static List<String> examplesOf(List<TextDelta> deltas, TextDelta.Kind kind) {
        return deltas.stream()
                .filter(delta -> delta.kind() == kind)
                .limit(2)
                .map(delta -> truncate(delta.content(), EXAMPLE_LENGTH))
                .collect(Collectors.toList());
    }

    private static long countOf(List<TextDelta> deltas, TextDelta.Kind kind) {
        return deltas.stream().filter(delta -> delta.kind() == kind).count();
    }

    private static String truncate(String value, int limit) {
        return value.length() <= limit ? value : value.substring(0, limit);
    }
}
