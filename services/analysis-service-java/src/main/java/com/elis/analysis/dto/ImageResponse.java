package com.elis.analysis.dto;

import com.elis.analysis.model.Image;
import com.elis.analysis.model.ImageSource;

import java.time.Instant;
import java.util.UUID;

public record ImageResponse(UUID id, String filename, long fileSize, ImageSource sourceType,
                            UUID documentId, Instant uploadedAt) {

    public static ImageResponse from(Image image) {
        return new ImageResponse(
                image.getId(),
                image.getFilename(),
                image.getFileSize(),
                image.getSourceType(),
                image.getDocumentId(),
                image.getUploadedAt()
        );
    }
}
