package com.elis.analysis.service.handler;

import com.elis.analysis.exception.ConfigurationException;
import com.elis.analysis.model.Job;
import com.elis.analysis.tool.InvocationResult;
import com.elis.analysis.tool.ToolCatalog;
import com.elis.analysis.tool.ToolContract;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public abstract class AbstractJobKindHandler implements JobKindHandler {

    private static final int MAX_STDERR_IN_ERROR = 500;

    protected final ToolCatalog catalog;
    private final String toolName;

    protected AbstractJobKindHandler(ToolCatalog catalog, String toolName) {
        this.catalog = catalog;
        this.toolName = toolName;
    }

    @Override
    public Map<String, String> normalizeOptions(Map<String, String> options) throws ConfigurationException {
        return contract().normalizeOptions(options);
    }

    @Override
    public PreparedInvocation prepare(Job job, Map<String, String> options) throws ConfigurationException {
        ToolContract contract = contract();
        Map<String, String> normalized = contract.normalizeOptions(options);
        Path input = resolveInput(job);
        if (!Files.isRegularFile(input)) {
            throw new ConfigurationException(contract.inputRole(), "input file missing: " + input);
        }
        return new PreparedInvocation(catalog.ref(toolName), Map.of(contract.inputRole(), input), normalized);
    }

    /**
     * Stored file of the job's subject.
     *
     * @throws ConfigurationException if the subject no longer exists
     */
    protected abstract Path resolveInput(Job job) throws ConfigurationException;

    @Override
    public ToolOutcome interpret(Job job, PreparedInvocation prepared, InvocationResult invocation) {
        List<String> errors = new ArrayList<>();
        if (!invocation.success()) {
            errors.add(describeFailure(invocation));
        }
        Map<String, Object> details = new LinkedHashMap<>();
        inspect(prepared, invocation, details, errors);
        return new ToolOutcome(toolName, invocation.message(), invocation.exitCode(),
                invocation.artifacts(), errors, details);
    }

    /**
     * Hook for tool-specific output checks. Adds result entries to {@code details} and
     * problems to {@code errors}.
     */
    protected void inspect(PreparedInvocation prepared, InvocationResult invocation,
                           Map<String, Object> details, List<String> errors) {
    }

    @Override
    public Map<String, Object> materialize(Job job, ToolOutcome outcome) {
        return Map.of();
    }

    protected ToolContract contract() {
        return catalog.contract(toolName);
    }

    private static String describeFailure(InvocationResult invocation) {
        String stderr = invocation.stderr() == null ? "" : invocation.stderr().strip();
        if (stderr.isEmpty()) {
            return invocation.message();
        }
        if (stderr.length() > MAX_STDERR_IN_ERROR) {
            stderr = "..." + stderr.substring(stderr.length() - MAX_STDERR_IN_ERROR);
        }
        return invocation.message() + ": " + stderr;
    }
}
