package com.monitintel.service.runtime;

import com.monitintel.collectors.api.CollectorResult;
import com.monitintel.service.pipeline.PipelineRun;

import java.util.Optional;

public record CycleReport(
        long cycleNumber,
        CollectorResult ingest,
        int retentionDeleted,
        Optional<PipelineRun> pipeline,
        long durationMillis
) {
    public boolean success() {
        return ingest.success() && pipeline.isPresent();
    }

    public int criticalServices() {
        return pipeline.map(PipelineRun::criticalCount).orElse(0);
    }
}
