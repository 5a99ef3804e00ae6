package com.pagewatch.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Facet-specific payload of a change record. Only the lists relevant to the record's type are populated.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ChangeDetails(
        List<ImageDescriptor> images,
        List<LinkDescriptor> links,
        List<TextDelta> textDeltas,
        List<String> addedMarkers,
        List<String> removedMarkers,
        List<String> changedAttributes
) {
    public ChangeDetails {
        images = images == null ? List.of() : List.copyOf(images);
        links = links == null ? List.of() : List.copyOf(links);
        textDeltas = textDeltas == null ? List.of() : List.copyOf(textDeltas);
        addedMarkers = addedMarkers == null ? List.of() : List.copyOf(addedMarkers);
        removedMarkers = removedMarkers == null ? List.of() : List.copyOf(removedMarkers);
        changedAttributes = changedAttributes == null ? List.of() : List.copyOf(changedAttributes);
    }

    public static ChangeDetails ofImages(List<ImageDescriptor> images) {
        return new ChangeDetails(images, null, null, null, null, null);
    }

    public static ChangeDetails ofModifiedImages(List<ImageDescriptor> images, List<String> changedAttributes) {
        return new ChangeDetails(images, null, null, null, null, changedAttributes);
    }

    public static ChangeDetails ofLinks(List<LinkDescriptor> links) {
        return new ChangeDetails(null, links, null, null, null, null);
    }

    public static ChangeDetails ofText(List<TextDelta> deltas) {
        return new ChangeDetails(null, null, deltas, null, null, null);
    }

    public static ChangeDetails ofStructure(List<String> added, List<String> removed) {
        return new ChangeDetails(null, null, null, added, removed, null);
    }
}
