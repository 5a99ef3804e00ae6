package com.pagewatch.service.stats;

import com.pagewatch.core.model.ChangeRecord;
import com.pagewatch.core.model.ChangeType;
import com.pagewatch.core.model.DetectedEntity;
import com.pagewatch.core.model.Job;
import com.pagewatch.core.model.JobStats;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class StatsAggregator {
    private StatsAggregator() {
    }

    /**
     * Derives statistics from the retained records (oldest first) and the job's all-time counters.
     * Only record-derived figures are bounded by the ledger; counters come from the job itself.
     */
    public static JobStats aggregate(Job job, List<ChangeRecord> retained) {
        Map<ChangeType, Long> byType = new EnumMap<>(ChangeType.class);
        Set<String> entities = new LinkedHashSet<>();
        int annotated = 0;
        int notable = 0;
        for (ChangeRecord record : retained) {
            byType.merge(record.type(), 1L, Long::sum);
            if (!record.annotated()) {
                continue;
            }
            annotated++;
            if (record.annotation().notableEntityDetected()) {
                notable++;
            }
            for (DetectedEntity entity : record.annotation().entities()) {
                if (entity.name() != null && !entity.name().isBlank()) {
                    entities.add(entity.name().trim());
                }
            }
        }
        Map<String, Long> changeTypes = new LinkedHashMap<>();
        byType.forEach((type, count) -> changeTypes.put(type.tag(), count));

        return new JobStats(
                job.id(),
                job.status(),
                job.createdAt(),
                job.lastCheck(),
                job.totalChecks(),
                job.changesDetected(),
                job.failedChecks(),
                job.lastError(),
                retained.size(),
                changeTypes,
                annotated,
                notable,
                List.copyOf(entities)
        );
    }
}
