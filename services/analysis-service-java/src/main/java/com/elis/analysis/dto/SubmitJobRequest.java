package com.elis.analysis.dto;

import com.elis.analysis.model.JobKind;

import java.util.Map;
import java.util.UUID;

public record SubmitJobRequest(JobKind kind, UUID subjectId, Map<String, String> options) {
}
