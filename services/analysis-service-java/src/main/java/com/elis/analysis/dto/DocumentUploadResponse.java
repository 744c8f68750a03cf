package com.elis.analysis.dto;

public record DocumentUploadResponse(DocumentResponse document, JobResponse extractionJob) {
}
