package com.pagewatch.core.model;

import com.pagewatch.core.util.HashingUtils;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Point-in-time capture of a page, reduced to the facets the differ compares.
 */
public record PageSnapshot(
        String url,
        String title,
        List<String> paragraphs,
        List<ImageDescriptor> images,
        List<LinkDescriptor> links,
        List<String> headings,
        String contentHash,
        Instant fetchedAt
) {
    public PageSnapshot {
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(fetchedAt, "fetchedAt is required");
        title = title == null ? "" : title;
        paragraphs = paragraphs == null ? List.of() : List.copyOf(paragraphs);
        images = images == null ? List.of() : List.copyOf(images);
        links = links == null ? List.of() : List.copyOf(links);
        headings = headings == null ? List.of() : List.copyOf(headings);
        if (contentHash == null || contentHash.isBlank()) {
            contentHash = hashOf(paragraphs, images, links, headings);
        }
    }

    public static PageSnapshot of(
            String url,
            String title,
            List<String> paragraphs,
            List<ImageDescriptor> images,
            List<LinkDescriptor> links,
            List<String> headings,
            Instant fetchedAt
    ) {
        return new PageSnapshot(url, title, paragraphs, images, links, headings, null, fetchedAt);
    }

    private static String hashOf(
            List<String> paragraphs,
            List<ImageDescriptor> images,
            List<LinkDescriptor> links,
            List<String> headings
    ) {
        StringBuilder canonical = new StringBuilder();
        paragraphs.forEach(paragraph -> canonical.append("p:").append(paragraph).append('\n'));
        images.forEach(image -> canonical.append("i:").append(image).append('\n'));
        links.forEach(link -> canonical.append("l:").append(link.key()).append('\n'));
        headings.forEach(heading -> canonical.append("h:").append(heading).append('\n'));
        return HashingUtils.sha256(canonical.toString());
    }
}
