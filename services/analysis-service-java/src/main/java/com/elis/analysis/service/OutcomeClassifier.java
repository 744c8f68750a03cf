package com.elis.analysis.service;

import com.elis.analysis.model.JobStatus;
import com.elis.analysis.service.handler.ToolOutcome;
import org.springframework.stereotype.Component;

/**
 * Terminal status of a tool run that finished within its limits. A run without artifacts
 * fails whatever the tool reported.
 */
@Component
public class OutcomeClassifier {

    public JobStatus classify(ToolOutcome outcome) {
        if (outcome.artifacts().isEmpty()) {
            return JobStatus.FAILED;
        }
        return outcome.errors().isEmpty() ? JobStatus.COMPLETED : JobStatus.COMPLETED_WITH_ERRORS;
    }
}
