package com.monitintel.service.pipeline;

import com.monitintel.core.model.WorkflowContext;

import java.util.Optional;

/**
 * Outcome of one detect, fetch, handoff pass. {@code advisory} is empty when nothing was critical
 * or the handoff failed.
 */
public record PipelineRun(WorkflowContext context, boolean handedOff, Optional<Advisory> advisory) {
    public int criticalCount() {
        return context.criticalServices().size();
    }
}
