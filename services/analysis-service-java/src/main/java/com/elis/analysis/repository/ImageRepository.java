package com.elis.analysis.repository;

import com.elis.analysis.model.Image;
import com.elis.analysis.model.ImageSource;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ImageRepository extends JpaRepository<Image, UUID> {

    List<Image> findByUser_IdOrderByUploadedAtDesc(UUID userId);

    Optional<Image> findByIdAndUser_Id(UUID id, UUID userId);

    List<Image> findByDocumentIdOrderByFilenameAsc(UUID documentId);

    List<Image> findByDocumentIdAndSourceType(UUID documentId, ImageSource sourceType);
}
