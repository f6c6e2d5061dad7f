package com.monitintel.service.pipeline;

import com.monitintel.core.model.WorkflowContext;

/**
 * External collaborator that turns a cycle bundle into free-text advice. The text is stored and
 * shown, never interpreted.
 */
public interface AnalysisClient {
    /**
     * @throws IllegalStateException when the collaborator cannot be reached or rejects the bundle
     */
    String analyze(WorkflowContext context);
}
