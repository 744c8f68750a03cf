package com.elis.analysis.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Kinds of analysis work that can be queued. Each kind runs exactly one containerized tool.
 */
public enum JobKind {
    EXTRACT_IMAGES(SubjectType.DOCUMENT, "image extraction"),
    DETECT_TAMPER(SubjectType.IMAGE, "tamper detection"),
    REMOVE_WATERMARK(SubjectType.DOCUMENT, "watermark removal");

    private final SubjectType subjectType;
    private final String label;

    JobKind(SubjectType subjectType, String label) {
        this.subjectType = subjectType;
        this.label = label;
    }

    public SubjectType subjectType() {
        return subjectType;
    }

    public String label() {
        return label;
    }

    /**
     * Accepts {@code remove_watermark} as well as {@code REMOVE_WATERMARK}.
     */
    @JsonCreator
    public static JobKind fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
