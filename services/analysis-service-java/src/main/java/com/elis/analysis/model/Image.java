package com.elis.analysis.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "images", indexes = @Index(name = "idx_images_document", columnList = "document_id"))
public class Image {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(nullable = false)
    private String filename;

    @Column(name = "file_path", nullable = false, length = 1024)
    private String filePath;

    @Column(name = "file_size", nullable = false)
    private long fileSize;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false)
    private ImageSource sourceType;

    @Column(name = "document_id")
    private UUID documentId;

    @CreationTimestamp
    private Instant uploadedAt;

    public Image() {}

    public Image(String filename, String filePath, long fileSize, ImageSource sourceType, User user) {
        this.filename = filename;
        this.filePath = filePath;
        this.fileSize = fileSize;
        this.sourceType = sourceType;
        this.user = user;
    }

    public UUID getId() { return id; }
    public User getUser() { return user; }
    public UUID getUserId() { return user != null ? user.getId() : null; }
    public String getFilename() { return filename; }
    public String getFilePath() { return filePath; }
    public long getFileSize() { return fileSize; }
    public ImageSource getSourceType() { return sourceType; }
    public UUID getDocumentId() { return documentId; }
    public Instant getUploadedAt() { return uploadedAt; }

    public void setId(UUID id) { this.id = id; }
    public void setUser(User user) { this.user = user; }
    public void setFilename(String filename) { this.filename = filename; }
    public void setFilePath(String filePath) { this.filePath = filePath; }
    public void setFileSize(long fileSize) { this.fileSize = fileSize; }
    public void setSourceType(ImageSource sourceType) { this.sourceType = sourceType; }
    public void setDocumentId(UUID documentId) { this.documentId = documentId; }
    public void setUploadedAt(Instant uploadedAt) { this.uploadedAt = uploadedAt; }
}
