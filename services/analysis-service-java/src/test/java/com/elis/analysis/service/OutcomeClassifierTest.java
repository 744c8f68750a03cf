package com.elis.analysis.service;

import com.elis.analysis.model.JobStatus;
import com.elis.analysis.service.handler.ToolOutcome;
import com.elis.analysis.tool.Artifact;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OutcomeClassifierTest {

    private final OutcomeClassifier classifier = new OutcomeClassifier();

    private static final Artifact FILE = new Artifact("out.png", Path.of("/tmp/out.png"), 10);

    @Test
    void artifactsWithoutErrors_completed() {
        ToolOutcome outcome = new ToolOutcome("trufor", "ok", 0, List.of(FILE), List.of(), Map.of());

        assertThat(classifier.classify(outcome)).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void artifactsWithErrors_completedWithErrors() {
        ToolOutcome outcome = new ToolOutcome("trufor", "exited with code 1", 1, List.of(FILE),
                List.of("exited with code 1"), Map.of());

        assertThat(classifier.classify(outcome)).isEqualTo(JobStatus.COMPLETED_WITH_ERRORS);
    }

    @Test
    void noArtifacts_failedEvenOnCleanExit() {
        ToolOutcome outcome = new ToolOutcome("pdf-extractor", "ok", 0, List.of(), List.of(), Map.of());

        assertThat(classifier.classify(outcome)).isEqualTo(JobStatus.FAILED);
        assertThat(outcome.summary()).isEqualTo("ok; no output files produced");
    }
}
