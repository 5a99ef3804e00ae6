package com.pagewatch.core.model;

public record DetectedEntity(
        String name,
        String category,
        String confidence,
        String evidence,
        String provenance
) {
}
