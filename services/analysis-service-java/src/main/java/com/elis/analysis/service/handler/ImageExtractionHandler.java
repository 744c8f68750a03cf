package com.elis.analysis.service.handler;

import com.elis.analysis.exception.ConfigurationException;
import com.elis.analysis.model.Document;
import com.elis.analysis.model.Image;
import com.elis.analysis.model.ImageSource;
import com.elis.analysis.model.Job;
import com.elis.analysis.model.JobKind;
import com.elis.analysis.repository.DocumentRepository;
import com.elis.analysis.repository.ImageRepository;
import com.elis.analysis.tool.Artifact;
import com.elis.analysis.tool.PdfExtractorContract;
import com.elis.analysis.tool.ToolCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Extracts embedded images from a document. Each produced file becomes an EXTRACTED image
 * of the document; a re-run replaces the previous set.
 */
@Component
public class ImageExtractionHandler extends AbstractJobKindHandler {

    private static final Logger log = LoggerFactory.getLogger(ImageExtractionHandler.class);

    private final DocumentRepository documentRepository;
    private final ImageRepository imageRepository;

    public ImageExtractionHandler(ToolCatalog catalog, DocumentRepository documentRepository,
                                  ImageRepository imageRepository) {
        super(catalog, PdfExtractorContract.NAME);
        this.documentRepository = documentRepository;
        this.imageRepository = imageRepository;
    }

    @Override
    public JobKind kind() {
        return JobKind.EXTRACT_IMAGES;
    }

    @Override
    protected Path resolveInput(Job job) throws ConfigurationException {
        Document document = documentRepository.findById(job.getSubjectId())
                .orElseThrow(() -> new ConfigurationException("subjectId", "document not found: " + job.getSubjectId()));
        return Path.of(document.getFilePath());
    }

    @Override
    @Transactional
    public Map<String, Object> materialize(Job job, ToolOutcome outcome) {
        Document document = documentRepository.findById(job.getSubjectId())
                .orElseThrow(() -> new IllegalStateException("Document " + job.getSubjectId() + " was deleted"));

        List<Image> previous = imageRepository.findByDocumentIdAndSourceType(document.getId(), ImageSource.EXTRACTED);
        if (!previous.isEmpty()) {
            log.info("Job {} replacing {} previously extracted image(s) of document {}",
                    job.getId(), previous.size(), document.getId());
            imageRepository.deleteAll(previous);
        }

        List<Image> images = new ArrayList<>();
        for (Artifact artifact : outcome.artifacts()) {
            var image = new Image(artifact.path().getFileName().toString(), artifact.path().toString(),
                    artifact.size(), ImageSource.EXTRACTED, document.getUser());
            image.setDocumentId(document.getId());
            images.add(image);
        }
        List<UUID> ids = imageRepository.saveAll(images).stream().map(Image::getId).toList();
        log.info("Job {} created {} image(s) for document {}", job.getId(), ids.size(), document.getId());

        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("imageCount", ids.size());
        extra.put("imageIds", ids);
        return extra;
    }
}
