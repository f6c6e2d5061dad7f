package com.monitintel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-cycle bundle handed to the analysis collaborator. Never persisted.
 */
public record WorkflowContext(Instant cycleAt, Map<String, ServiceAssessment> services) {
    public WorkflowContext {
        Objects.requireNonNull(cycleAt, "cycleAt is required");
        services = services == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(services));
    }

    public static WorkflowContext of(Instant cycleAt, List<ServiceAssessment> assessments) {
        Map<String, ServiceAssessment> byService = new LinkedHashMap<>();
        for (ServiceAssessment assessment : assessments) {
            byService.put(assessment.serviceName(), assessment);
        }
        return new WorkflowContext(cycleAt, byService);
    }

    public List<String> criticalServices() {
        return services.values().stream()
                .filter(ServiceAssessment::critical)
                .map(ServiceAssessment::serviceName)
                .toList();
    }

    public boolean hasCritical() {
        return services.values().stream().anyMatch(ServiceAssessment::critical);
    }

    public WorkflowContext withLogs(Map<String, LogExcerpt> excerpts) {
        Map<String, ServiceAssessment> updated = new LinkedHashMap<>();
        for (ServiceAssessment assessment : services.values()) {
            LogExcerpt excerpt = excerpts.get(assessment.serviceName());
            updated.put(assessment.serviceName(), excerpt == null ? assessment : assessment.withLogs(excerpt));
        }
        return new WorkflowContext(cycleAt, updated);
    }
}
