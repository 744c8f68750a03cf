package com.elis.analysis.service.handler;

import com.elis.analysis.exception.ConfigurationException;
import com.elis.analysis.model.Image;
import com.elis.analysis.model.Job;
import com.elis.analysis.model.JobKind;
import com.elis.analysis.repository.ImageRepository;
import com.elis.analysis.tool.Artifact;
import com.elis.analysis.tool.InvocationResult;
import com.elis.analysis.tool.TamperDetectionContract;
import com.elis.analysis.tool.ToolCatalog;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Runs tamper localization on an image. The maps only appear in the job result.
 */
@Component
public class TamperDetectionHandler extends AbstractJobKindHandler {

    private final ImageRepository imageRepository;

    public TamperDetectionHandler(ToolCatalog catalog, ImageRepository imageRepository) {
        super(catalog, TamperDetectionContract.NAME);
        this.imageRepository = imageRepository;
    }

    @Override
    public JobKind kind() {
        return JobKind.DETECT_TAMPER;
    }

    @Override
    protected Path resolveInput(Job job) throws ConfigurationException {
        Image image = imageRepository.findById(job.getSubjectId())
                .orElseThrow(() -> new ConfigurationException("subjectId", "image not found: " + job.getSubjectId()));
        return Path.of(image.getFilePath());
    }

    @Override
    protected void inspect(PreparedInvocation prepared, InvocationResult invocation,
                           Map<String, Object> details, List<String> errors) {
        Optional<Artifact> predMap = find(invocation, name -> name.contains("pred"));
        Optional<Artifact> confMap = find(invocation, name -> name.contains("conf"));
        Optional<Artifact> noiseprint = find(invocation, name -> name.endsWith(".npz") || name.contains("noiseprint"));

        details.put("predMap", predMap.map(a -> a.path().toString()).orElse(null));
        details.put("confMap", confMap.map(a -> a.path().toString()).orElse(null));
        noiseprint.ifPresent(a -> details.put("noiseprint", a.path().toString()));

        if (invocation.artifacts().isEmpty()) {
            return;
        }
        if (predMap.isEmpty()) {
            errors.add("prediction map was not produced");
        }
        if (confMap.isEmpty()) {
            errors.add("confidence map was not produced");
        }
        if (Boolean.parseBoolean(prepared.options().get(TamperDetectionContract.SAVE_NOISEPRINT)) && noiseprint.isEmpty()) {
            errors.add("noiseprint was requested but not produced");
        }
    }

    private static Optional<Artifact> find(InvocationResult invocation, Predicate<String> matcher) {
        return invocation.artifacts().stream()
                .filter(a -> matcher.test(a.name().toLowerCase(Locale.ROOT)))
                .findFirst();
    }
}
