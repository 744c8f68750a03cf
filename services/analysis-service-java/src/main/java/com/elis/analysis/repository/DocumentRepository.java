package com.elis.analysis.repository;

import com.elis.analysis.model.Document;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DocumentRepository extends JpaRepository<Document, UUID> {

    List<Document> findByUser_IdOrderByUploadedAtDesc(UUID userId);

    Optional<Document> findByIdAndUser_Id(UUID id, UUID userId);

    List<Document> findBySourceDocumentId(UUID sourceDocumentId);

    Optional<Document> findBySourceJobId(UUID sourceJobId);
}
