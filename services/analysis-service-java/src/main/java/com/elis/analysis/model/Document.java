package com.elis.analysis.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "documents")
public class Document {

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

    // Set on documents produced by a job, e.g. a watermark-free copy
    @Column(name = "source_document_id")
    private UUID sourceDocumentId;

    @Column(name = "source_job_id")
    private UUID sourceJobId;

    @CreationTimestamp
    private Instant uploadedAt;

    public Document() {}

    public Document(String filename, String filePath, long fileSize, User user) {
        this.filename = filename;
        this.filePath = filePath;
        this.fileSize = fileSize;
        this.user = user;
    }

    public UUID getId() { return id; }
    public User getUser() { return user; }
    public UUID getUserId() { return user != null ? user.getId() : null; }
    public String getFilename() { return filename; }
    public String getFilePath() { return filePath; }
    public long getFileSize() { return fileSize; }
    public UUID getSourceDocumentId() { return sourceDocumentId; }
    public UUID getSourceJobId() { return sourceJobId; }
    public Instant getUploadedAt() { return uploadedAt; }

    public void setId(UUID id) { this.id = id; }
    public void setUser(User user) { this.user = user; }
    public void setFilename(String filename) { this.filename = filename; }
    public void setFilePath(String filePath) { this.filePath = filePath; }
    public void setFileSize(long fileSize) { this.fileSize = fileSize; }
    public void setSourceDocumentId(UUID sourceDocumentId) { this.sourceDocumentId = sourceDocumentId; }
    public void setSourceJobId(UUID sourceJobId) { this.sourceJobId = sourceJobId; }
    public void setUploadedAt(Instant uploadedAt) { this.uploadedAt = uploadedAt; }
}
