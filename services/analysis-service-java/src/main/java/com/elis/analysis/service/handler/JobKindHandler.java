package com.elis.analysis.service.handler;

import com.elis.analysis.exception.ConfigurationException;
import com.elis.analysis.model.Job;
import com.elis.analysis.model.JobKind;
import com.elis.analysis.tool.InvocationResult;

import java.util.Map;

/**
 * Kind-specific half of job execution: which tool runs on which input, what its output
 * means, and which business records it produces.
 */
public interface JobKindHandler {

    JobKind kind();

    /**
     * Validates options and fills in defaults without touching the subject.
     */
    Map<String, String> normalizeOptions(Map<String, String> options) throws ConfigurationException;

    /**
     * Resolves the job's subject to an input file and checks its options.
     *
     * @throws ConfigurationException if the subject or its file is missing or an option is invalid
     */
    PreparedInvocation prepare(Job job, Map<String, String> options) throws ConfigurationException;

    ToolOutcome interpret(Job job, PreparedInvocation prepared, InvocationResult invocation);

    /**
     * Creates the derived records for a successful run.
     *
     * @return extra entries for the job result
     */
    Map<String, Object> materialize(Job job, ToolOutcome outcome);
}
