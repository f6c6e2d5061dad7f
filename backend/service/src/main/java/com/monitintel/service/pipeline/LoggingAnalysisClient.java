package com.monitintel.service.pipeline;

import com.monitintel.core.model.ServiceAssessment;
import com.monitintel.core.model.WorkflowContext;

import java.util.logging.Logger;

public class LoggingAnalysisClient implements AnalysisClient {
    private static final Logger LOGGER = Logger.getLogger(LoggingAnalysisClient.class.getName());

    @Override
    public String analyze(WorkflowContext context) {
        for (ServiceAssessment assessment : context.services().values()) {
            if (!assessment.critical()) {
                continue;
            }
            int lines = assessment.logExcerpt().map(excerpt -> excerpt.lines().size()).orElse(0);
            String reason = assessment.logExcerpt().map(excerpt -> excerpt.reason()).orElse(null);
            LOGGER.info("Critical " + assessment.outcome() + " for " + assessment.serviceName()
                    + " (status " + assessment.status() + ", timesFailed " + assessment.state().timesFailed()
                    + ", " + lines + " log lines" + (reason == null ? "" : ", " + reason) + ")");
        }
        return "";
    }
}
