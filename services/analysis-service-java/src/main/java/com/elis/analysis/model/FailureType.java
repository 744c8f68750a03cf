package com.elis.analysis.model;

/**
 * Why a job ended up FAILED. INFRASTRUCTURE and TIMEOUT failures are retried before they get here.
 */
public enum FailureType {
    CONFIGURATION,
    INFRASTRUCTURE,
    TIMEOUT,
    TOOL_REPORTED
}
