package com.pagewatch.core.model;

import java.util.List;

public record Annotation(
        boolean notableEntityDetected,
        List<DetectedEntity> entities,
        String addedEntity,
        String removedEntity,
        String modifiedEntity,
        String summary
) {
    public Annotation {
        entities = entities == null ? List.of() : List.copyOf(entities);
    }
}
