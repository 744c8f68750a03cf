package com.elis.analysis.dto;

import com.elis.analysis.model.Document;

import java.time.Instant;
import java.util.UUID;

public record DocumentResponse(UUID id, String filename, long fileSize, UUID sourceDocumentId,
                               UUID sourceJobId, Instant uploadedAt) {

    public static DocumentResponse from(Document document) {
        return new DocumentResponse(
                document.getId(),
                document.getFilename(),
                document.getFileSize(),
                document.getSourceDocumentId(),
                document.getSourceJobId(),
                document.getUploadedAt()
        );
    }
}
