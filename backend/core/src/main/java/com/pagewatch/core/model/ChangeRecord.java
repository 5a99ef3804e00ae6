package com.pagewatch.core.model;

import java.time.Instant;
import java.util.Objects;

public record ChangeRecord(
        ChangeType type,
        String description,
        ChangeDetails details,
        Annotation annotation,
        Instant detectedAt
) {
    public ChangeRecord {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(description, "description is required");
        Objects.requireNonNull(detectedAt, "detectedAt is required");
        details = details == null ? ChangeDetails.ofImages(null) : details;
    }

    public ChangeRecord withAnnotation(Annotation value) {
        return new ChangeRecord(type, description, details, value, detectedAt);
    }

    public boolean annotated() {
        return annotation != null;
    }
}
