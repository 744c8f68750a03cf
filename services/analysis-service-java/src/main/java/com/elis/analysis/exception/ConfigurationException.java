package com.elis.analysis.exception;

/**
 * Job parameters a tool cannot accept. Raised before any subprocess or file is touched and
 * never retried.
 */
public class ConfigurationException extends Exception {

    private final String field;

    public ConfigurationException(String message) {
        this(null, message);
    }

    public ConfigurationException(String field, String message) {
        super(field != null ? field + ": " + message : message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
