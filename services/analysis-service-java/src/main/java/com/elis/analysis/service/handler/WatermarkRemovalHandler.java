package com.elis.analysis.service.handler;

import com.elis.analysis.exception.ConfigurationException;
import com.elis.analysis.model.Document;
import com.elis.analysis.model.Job;
import com.elis.analysis.model.JobKind;
import com.elis.analysis.repository.DocumentRepository;
import com.elis.analysis.tool.Artifact;
import com.elis.analysis.tool.InvocationResult;
import com.elis.analysis.tool.ToolCatalog;
import com.elis.analysis.tool.WatermarkRemovalContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Produces a watermark-free copy of a document, stored as a derived document.
 */
@Component
public class WatermarkRemovalHandler extends AbstractJobKindHandler {

    private static final Logger log = LoggerFactory.getLogger(WatermarkRemovalHandler.class);

    static final String OUTPUT_FILE = "outputFile";

    private final DocumentRepository documentRepository;

    public WatermarkRemovalHandler(ToolCatalog catalog, DocumentRepository documentRepository) {
        super(catalog, WatermarkRemovalContract.NAME);
        this.documentRepository = documentRepository;
    }

    @Override
    public JobKind kind() {
        return JobKind.REMOVE_WATERMARK;
    }

    @Override
    protected Path resolveInput(Job job) throws ConfigurationException {
        Document document = documentRepository.findById(job.getSubjectId())
                .orElseThrow(() -> new ConfigurationException("subjectId", "document not found: " + job.getSubjectId()));
        return Path.of(document.getFilePath());
    }

    @Override
    protected void inspect(PreparedInvocation prepared, InvocationResult invocation,
                           Map<String, Object> details, List<String> errors) {
        String mode = prepared.options().get(WatermarkRemovalContract.AGGRESSIVENESS);
        Path input = prepared.inputs().get(WatermarkRemovalContract.INPUT_ROLE);
        String expected = WatermarkRemovalContract.outputFilename(input, mode);
        details.put(WatermarkRemovalContract.AGGRESSIVENESS, Integer.parseInt(mode));
        details.put(OUTPUT_FILE, expected);
        if (!invocation.artifacts().isEmpty()
                && invocation.artifacts().stream().noneMatch(a -> a.name().equals(expected))) {
            errors.add("expected output " + expected + " was not produced");
        }
    }

    @Override
    @Transactional
    public Map<String, Object> materialize(Job job, ToolOutcome outcome) {
        Document source = documentRepository.findById(job.getSubjectId())
                .orElseThrow(() -> new IllegalStateException("Document " + job.getSubjectId() + " was deleted"));
        Object expected = outcome.details().get(OUTPUT_FILE);
        Artifact cleaned = outcome.artifacts().stream()
                .filter(a -> a.name().equals(expected))
                .findFirst()
                .orElse(outcome.artifacts().get(0));

        Document derived = documentRepository.findBySourceJobId(job.getId())
                .orElseGet(() -> new Document(null, null, 0, source.getUser()));
        derived.setFilename(cleaned.path().getFileName().toString());
        derived.setFilePath(cleaned.path().toString());
        derived.setFileSize(cleaned.size());
        derived.setSourceDocumentId(source.getId());
        derived.setSourceJobId(job.getId());
        derived = documentRepository.save(derived);
        log.info("Job {} stored watermark-free copy {} of document {}", job.getId(), derived.getId(), source.getId());

        return Map.of("derivedDocumentId", derived.getId());
    }
}
