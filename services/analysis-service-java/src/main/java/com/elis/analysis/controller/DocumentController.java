package com.elis.analysis.controller;

import com.elis.analysis.dto.DocumentResponse;
import com.elis.analysis.dto.DocumentUploadResponse;
import com.elis.analysis.dto.ImageResponse;
import com.elis.analysis.dto.JobResponse;
import com.elis.analysis.model.JobKind;
import com.elis.analysis.model.User;
import com.elis.analysis.service.DocumentService;
import com.elis.analysis.service.JobService;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/documents")
public class DocumentController {

    private final DocumentService documentService;
    private final JobService jobService;

    public DocumentController(DocumentService documentService, JobService jobService) {
        this.documentService = documentService;
        this.jobService = jobService;
    }

    /**
     * Stores the PDF and queues image extraction for it.
     */
    @PostMapping(consumes = "multipart/form-data")
    @ResponseStatus(HttpStatus.CREATED)
    public DocumentUploadResponse upload(@RequestParam("file") MultipartFile file,
                                         @AuthenticationPrincipal User user) {
        var document = documentService.upload(file, user);
        var job = jobService.submitJob(JobKind.EXTRACT_IMAGES, document.getId(), user, Map.of());
        return new DocumentUploadResponse(DocumentResponse.from(document), JobResponse.from(job));
    }

    @GetMapping
    public List<DocumentResponse> listDocuments(@AuthenticationPrincipal User user) {
        return documentService.listDocuments(user.getId())
                .stream()
                .map(DocumentResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public DocumentResponse getDocument(@PathVariable UUID id,
                                        @AuthenticationPrincipal User user) {
        return DocumentResponse.from(documentService.getDocument(id, user.getId()));
    }

    @GetMapping("/{id}/images")
    public List<ImageResponse> listExtractedImages(@PathVariable UUID id,
                                                   @AuthenticationPrincipal User user) {
        return documentService.listExtractedImages(id, user.getId())
                .stream()
                .map(ImageResponse::from)
                .toList();
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteDocument(@PathVariable UUID id,
                               @AuthenticationPrincipal User user) {
        documentService.deleteDocument(id, user.getId());
    }
}
