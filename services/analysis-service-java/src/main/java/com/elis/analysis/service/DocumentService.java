package com.elis.analysis.service;

import com.elis.analysis.model.Document;
import com.elis.analysis.model.Image;
import com.elis.analysis.model.Job;
import com.elis.analysis.model.User;
import com.elis.analysis.repository.DocumentRepository;
import com.elis.analysis.repository.ImageRepository;
import com.elis.analysis.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Service
public class DocumentService {

    private static final Logger log = LoggerFactory.getLogger(DocumentService.class);

    private final DocumentRepository documentRepository;
    private final ImageRepository imageRepository;
    private final JobRepository jobRepository;
    private final WorkspaceStorage storage;

    public DocumentService(DocumentRepository documentRepository, ImageRepository imageRepository,
                           JobRepository jobRepository, WorkspaceStorage storage) {
        this.documentRepository = documentRepository;
        this.imageRepository = imageRepository;
        this.jobRepository = jobRepository;
        this.storage = storage;
    }

    @Transactional
    public Document upload(MultipartFile file, User user) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "File is empty");
        }
        String filename = file.getOriginalFilename();
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Only PDF documents are accepted");
        }

        var document = documentRepository.save(new Document(filename, "", file.getSize(), user));
        Path directory = storage.documentDir(user.getId(), document.getId());
        try {
            Path stored = storage.store(file, directory);
            document.setFilePath(stored.toString());
            document.setFileSize(Files.size(stored));
        } catch (IOException e) {
            storage.deleteQuietly(directory);
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to store document", e);
        }
        log.info("Document {} uploaded by {} ({} bytes)", document.getId(), user.getId(), document.getFileSize());
        return document;
    }

    @Transactional(readOnly = true)
    public Document getDocument(UUID documentId, UUID userId) {
        return documentRepository.findByIdAndUser_Id(documentId, userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Document not found"));
    }

    @Transactional(readOnly = true)
    public List<Document> listDocuments(UUID userId) {
        return documentRepository.findByUser_IdOrderByUploadedAtDesc(userId);
    }

    @Transactional(readOnly = true)
    public List<Image> listExtractedImages(UUID documentId, UUID userId) {
        getDocument(documentId, userId);
        return imageRepository.findByDocumentIdOrderByFilenameAsc(documentId);
    }

    /**
     * Deletes a document with its derived documents, extracted images, every job on any of
     * them, and their files.
     */
    @Transactional
    public void deleteDocument(UUID documentId, UUID userId) {
        Document document = getDocument(documentId, userId);
        List<Document> derived = documentRepository.findBySourceDocumentId(documentId);
        List<Image> images = imageRepository.findByDocumentIdOrderByFilenameAsc(documentId);

        List<UUID> subjects = new ArrayList<>();
        subjects.add(documentId);
        derived.forEach(d -> subjects.add(d.getId()));
        images.forEach(i -> subjects.add(i.getId()));

        List<Path> directories = new ArrayList<>();
        directories.add(storage.documentDir(userId, documentId));
        for (Job job : jobRepository.findBySubjectIdIn(subjects)) {
            directories.add(storage.jobDir(userId, job.getId()));
        }

        int jobs = jobRepository.deleteBySubjectIdIn(subjects);
        imageRepository.deleteAll(images);
        documentRepository.deleteAll(derived);
        documentRepository.delete(document);
        directories.forEach(storage::deleteQuietly);
        log.info("Document {} deleted with {} derived document(s), {} image(s), {} job(s)",
                documentId, derived.size(), images.size(), jobs);
    }
}
