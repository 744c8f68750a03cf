package com.elis.analysis.service;

import com.elis.analysis.exception.ToolUnavailableException;
import com.elis.analysis.messaging.JobMessage;
import com.elis.analysis.messaging.JobPublisher;
import com.elis.analysis.model.Document;
import com.elis.analysis.model.FailureType;
import com.elis.analysis.model.Image;
import com.elis.analysis.model.ImageSource;
import com.elis.analysis.model.Job;
import com.elis.analysis.model.JobKind;
import com.elis.analysis.model.JobStatus;
import com.elis.analysis.model.User;
import com.elis.analysis.repository.DocumentRepository;
import com.elis.analysis.repository.ImageRepository;
import com.elis.analysis.repository.JobRepository;
import com.elis.analysis.support.TestData;
import com.elis.analysis.tool.Artifact;
import com.elis.analysis.tool.InvocationResult;
import com.elis.analysis.tool.ToolInvoker;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.stubbing.Answer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@SpringBootTest
@ActiveProfiles("test")
class JobExecutorTest {

    private static final byte[] PDF = "%PDF-1.4 test".getBytes(StandardCharsets.US_ASCII);

    @Autowired
    private JobExecutor executor;

    @Autowired
    private JobStateStore store;

    @Autowired
    private JobRepository jobRepository;

    @Autowired
    private DocumentRepository documentRepository;

    @Autowired
    private ImageRepository imageRepository;

    @Autowired
    private TestData testData;

    @MockitoBean
    private ToolInvoker invoker;

    @MockitoBean
    private JobPublisher jobPublisher;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private User user;

    @BeforeEach
    void setUp() {
        testData.clear();
        user = testData.user("executor-user");
    }

    private Job submit(JobKind kind, UUID subjectId, String params) {
        return store.create(new Job(kind, subjectId, params, user, 3));
    }

    private Job reload(Job job) {
        return jobRepository.findById(job.getId()).orElseThrow();
    }

    private static JobMessage message(Job job, int retryCount) {
        return new JobMessage(job.getId(), job.getKind(), retryCount);
    }

    /** Stubs a tool run that writes the given files, with the given sizes, into the job's output directory. */
    private static Answer<InvocationResult> writes(int exitCode, Map<String, Integer> files) {
        return invocation -> {
            Path outputDir = invocation.getArgument(3);
            List<Artifact> artifacts = new ArrayList<>();
            for (Map.Entry<String, Integer> file : files.entrySet()) {
                Path path = Files.write(outputDir.resolve(file.getKey()), new byte[file.getValue()]);
                artifacts.add(new Artifact(file.getKey(), path, file.getValue()));
            }
            return InvocationResult.exited("tool", exitCode, artifacts, "", exitCode == 0 ? "" : "boom");
        };
    }

    @Test
    void watermarkRemoval_completesAndStoresDerivedDocument() throws Exception {
        Document document = testData.document(user, "paper.pdf", PDF);
        Job job = submit(JobKind.REMOVE_WATERMARK, document.getId(), "{\"aggressiveness\":\"2\"}");
        given(invoker.invoke(any(), any(), any(), any(), any()))
                .willAnswer(writes(0, Map.of("paper_watermark_removed_m2.pdf", 12345)));

        ExecutionOutcome outcome = executor.execute(message(job, 0));

        assertThat(outcome.disposition()).isEqualTo(ExecutionOutcome.Disposition.FINALIZED);
        Job stored = reload(job);
        assertThat(stored.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(stored.getStatusMessage()).isEqualTo("Completed");
        assertThat(stored.getError()).isNull();
        assertThat(stored.getLeaseOwner()).isNull();
        assertThat(stored.getCompletedAt()).isNotNull();

        JsonNode result = objectMapper.readTree(stored.getResult());
        assertThat(result.at("/artifacts/0/name").asText()).isEqualTo("paper_watermark_removed_m2.pdf");
        assertThat(result.at("/artifacts/0/size").asLong()).isEqualTo(12345);
        assertThat(result.get("aggressiveness").asInt()).isEqualTo(2);

        UUID derivedId = UUID.fromString(result.get("derivedDocumentId").asText());
        Document derived = documentRepository.findById(derivedId).orElseThrow();
        assertThat(derived.getSourceDocumentId()).isEqualTo(document.getId());
        assertThat(derived.getSourceJobId()).isEqualTo(job.getId());
        assertThat(derived.getFileSize()).isEqualTo(12345);
    }

    @Test
    void noArtifacts_failsAsToolReported() throws Exception {
        Document document = testData.document(user, "paper.pdf", PDF);
        Job job = submit(JobKind.REMOVE_WATERMARK, document.getId(), "{}");
        given(invoker.invoke(any(), any(), any(), any(), any())).willAnswer(writes(0, Map.of()));

        executor.execute(message(job, 0));

        Job stored = reload(job);
        assertThat(stored.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(stored.getFailureType()).isEqualTo(FailureType.TOOL_REPORTED);
        assertThat(stored.getError()).contains("no output files produced");
        assertThat(stored.getResult()).isNull();
        assertThat(stored.getRetryCount()).isZero();
    }

    @Test
    void redeliveredMessageForFailedJob_doesNotRunToolAgain() throws Exception {
        Document document = testData.document(user, "paper.pdf", PDF);
        Job job = submit(JobKind.REMOVE_WATERMARK, document.getId(), "{}");
        given(invoker.invoke(any(), any(), any(), any(), any())).willAnswer(writes(0, Map.of()));

        executor.execute(message(job, 0));
        ExecutionOutcome redelivered = executor.execute(message(job, 0));

        assertThat(redelivered.disposition()).isEqualTo(ExecutionOutcome.Disposition.SKIPPED);
        verify(invoker, times(1)).invoke(any(), any(), any(), any(), any());
        Job stored = reload(job);
        assertThat(stored.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(stored.getFailureType()).isEqualTo(FailureType.TOOL_REPORTED);
        assertThat(stored.getRetryCount()).isZero();
        assertThat(stored.getLeaseOwner()).isNull();
    }

    @Test
    void saveFailureAfterSuccessfulRun_completesWithErrorsAndKeepsArtifacts() throws Exception {
        Document document = testData.document(user, "paper.pdf", PDF);
        Job job = submit(JobKind.REMOVE_WATERMARK, document.getId(), "{}");
        Answer<InvocationResult> run = writes(0, Map.of("paper_watermark_removed_m2.pdf", 64));
        given(invoker.invoke(any(), any(), any(), any(), any())).willAnswer(invocation -> {
            InvocationResult result = run.answer(invocation);
            documentRepository.deleteById(document.getId());
            return result;
        });

        ExecutionOutcome outcome = executor.execute(message(job, 0));

        assertThat(outcome.disposition()).isEqualTo(ExecutionOutcome.Disposition.FINALIZED);
        Job stored = reload(job);
        assertThat(stored.getStatus()).isEqualTo(JobStatus.COMPLETED_WITH_ERRORS);
        assertThat(stored.getError()).isNull();
        assertThat(stored.getFailureType()).isNull();
        assertThat(stored.getResult()).isNotNull();
        JsonNode result = objectMapper.readTree(stored.getResult());
        assertThat(result.at("/artifacts/0/name").asText()).isEqualTo("paper_watermark_removed_m2.pdf");
        assertThat(result.at("/errors/0").asText()).startsWith("failed to save results");
        assertThat(result.has("derivedDocumentId")).isFalse();
    }

    @Test
    void nonZeroExitWithArtifacts_completesWithErrors() throws Exception {
        Document document = testData.document(user, "paper.pdf", PDF);
        Job job = submit(JobKind.REMOVE_WATERMARK, document.getId(), "{}");
        given(invoker.invoke(any(), any(), any(), any(), any()))
                .willAnswer(writes(2, Map.of("paper_watermark_removed_m2.pdf", 10)));

        executor.execute(message(job, 0));

        Job stored = reload(job);
        assertThat(stored.getStatus()).isEqualTo(JobStatus.COMPLETED_WITH_ERRORS);
        assertThat(stored.getStatusMessage()).isEqualTo("Completed with 1 error(s)");
        JsonNode result = objectMapper.readTree(stored.getResult());
        assertThat(result.get("exitCode").asInt()).isEqualTo(2);
        assertThat(result.at("/errors/0").asText()).contains("boom");
    }

    @Test
    void invalidStoredOptions_failWithoutInvokingTool() throws Exception {
        Document document = testData.document(user, "paper.pdf", PDF);
        Job job = submit(JobKind.REMOVE_WATERMARK, document.getId(), "{\"aggressiveness\":\"4\"}");

        executor.execute(message(job, 0));

        Job stored = reload(job);
        assertThat(stored.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(stored.getFailureType()).isEqualTo(FailureType.CONFIGURATION);
        assertThat(stored.getError()).contains("aggressiveness");
        assertThat(stored.getRetryCount()).isZero();
        verify(invoker, never()).invoke(any(), any(), any(), any(), any());
    }

    @Test
    void missingInputFile_failsAsConfiguration() throws Exception {
        Document document = testData.missingFileDocument(user);
        Job job = submit(JobKind.EXTRACT_IMAGES, document.getId(), "{}");

        executor.execute(message(job, 0));

        Job stored = reload(job);
        assertThat(stored.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(stored.getFailureType()).isEqualTo(FailureType.CONFIGURATION);
        verify(invoker, never()).invoke(any(), any(), any(), any(), any());
    }

    @Test
    void timeouts_backOffThenGiveUp() throws Exception {
        Document document = testData.document(user, "paper.pdf", PDF);
        Job job = submit(JobKind.REMOVE_WATERMARK, document.getId(), "{}");
        given(invoker.invoke(any(), any(), any(), any(), any()))
                .willReturn(InvocationResult.timeout("pdf-watermark-removal did not finish within PT25M", "", ""));

        List<Duration> delays = new ArrayList<>();
        for (int attempt = 0; attempt < 3; attempt++) {
            ExecutionOutcome outcome = executor.execute(message(job, attempt));
            assertThat(outcome.retryScheduled()).isTrue();
            delays.add(outcome.retry().delay());

            Job requeued = reload(job);
            assertThat(requeued.getStatus()).isEqualTo(JobStatus.QUEUED);
            assertThat(requeued.getRetryCount()).isEqualTo(attempt + 1);
            assertThat(requeued.getStatusMessage()).startsWith("Retry " + (attempt + 1) + "/3");
        }
        assertThat(delays).containsExactly(Duration.ofSeconds(60), Duration.ofSeconds(120), Duration.ofSeconds(240));

        ExecutionOutcome last = executor.execute(message(job, 3));

        assertThat(last.status()).isEqualTo(JobStatus.FAILED);
        Job stored = reload(job);
        assertThat(stored.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(stored.getRetryCount()).isEqualTo(3);
        assertThat(stored.getFailureType()).isEqualTo(FailureType.TIMEOUT);
        assertThat(stored.getError()).contains("gave up after 3 retries");
    }

    @Test
    void toolUnavailable_isRetried() throws Exception {
        Document document = testData.document(user, "paper.pdf", PDF);
        Job job = submit(JobKind.EXTRACT_IMAGES, document.getId(), "{}");
        given(invoker.invoke(any(), any(), any(), any(), any()))
                .willThrow(new ToolUnavailableException("pdf-extractor", "docker daemon not running"));

        ExecutionOutcome outcome = executor.execute(message(job, 0));

        assertThat(outcome.retryScheduled()).isTrue();
        assertThat(outcome.retry().nextRetryCount()).isEqualTo(1);
        Job stored = reload(job);
        assertThat(stored.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(stored.getStatusMessage()).contains("docker daemon not running");
        assertThat(stored.getError()).isNull();
    }

    @Test
    void extraction_replacesPreviouslyExtractedImages() throws Exception {
        Document document = testData.document(user, "paper.pdf", PDF);
        Image stale = new Image("old.png", "/tmp/old.png", 1, ImageSource.EXTRACTED, user);
        stale.setDocumentId(document.getId());
        stale = imageRepository.save(stale);
        Job job = submit(JobKind.EXTRACT_IMAGES, document.getId(), "{}");
        given(invoker.invoke(any(), any(), any(), any(), any()))
                .willAnswer(writes(0, Map.of("page1_img1.png", 100, "page2_img1.jpg", 200)));

        executor.execute(message(job, 0));

        Job stored = reload(job);
        assertThat(stored.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(objectMapper.readTree(stored.getResult()).get("imageCount").asInt()).isEqualTo(2);
        List<Image> images = imageRepository.findByDocumentIdAndSourceType(document.getId(), ImageSource.EXTRACTED);
        assertThat(images).extracting(Image::getFilename)
                .containsExactlyInAnyOrder("page1_img1.png", "page2_img1.jpg");
        assertThat(imageRepository.findById(stale.getId())).isEmpty();
    }

    @Test
    void tamperDetection_missingConfidenceMap_completesWithErrors() throws Exception {
        Image image = testData.image(user, "scan.png", new byte[]{1, 2, 3});
        Job job = submit(JobKind.DETECT_TAMPER, image.getId(), "{}");
        given(invoker.invoke(any(), any(), any(), any(), any()))
                .willAnswer(writes(0, Map.of("scan_pred_map.png", 64)));

        executor.execute(message(job, 0));

        Job stored = reload(job);
        assertThat(stored.getStatus()).isEqualTo(JobStatus.COMPLETED_WITH_ERRORS);
        JsonNode result = objectMapper.readTree(stored.getResult());
        assertThat(result.get("predMap").asText()).endsWith("scan_pred_map.png");
        assertThat(result.get("confMap").isNull()).isTrue();
        assertThat(result.at("/errors/0").asText()).isEqualTo("confidence map was not produced");
    }

    @Test
    void jobAlreadyClaimed_isSkipped() throws Exception {
        Document document = testData.document(user, "paper.pdf", PDF);
        Job job = submit(JobKind.REMOVE_WATERMARK, document.getId(), "{}");
        store.transition(job.getId(), Set.of(JobStatus.QUEUED), JobStatus.PROCESSING,
                JobTransition.builder().lease("other-worker", Duration.ofMinutes(35)).build());

        ExecutionOutcome outcome = executor.execute(message(job, 0));

        assertThat(outcome.disposition()).isEqualTo(ExecutionOutcome.Disposition.SKIPPED);
        assertThat(reload(job).getLeaseOwner()).isEqualTo("other-worker");
        verify(invoker, never()).invoke(any(), any(), any(), any(), any());
    }

    @Test
    void unknownJob_isSkipped() {
        ExecutionOutcome outcome = executor.execute(new JobMessage(UUID.randomUUID(), JobKind.EXTRACT_IMAGES, 0));

        assertThat(outcome.disposition()).isEqualTo(ExecutionOutcome.Disposition.SKIPPED);
    }

    @Test
    void abandon_requeuesAsTimeout() throws IOException {
        Document document = testData.document(user, "paper.pdf", PDF);
        Job job = submit(JobKind.REMOVE_WATERMARK, document.getId(), "{}");
        store.transition(job.getId(), Set.of(JobStatus.QUEUED), JobStatus.PROCESSING,
                JobTransition.builder().lease("stuck-worker", Duration.ofMinutes(35)).build());

        ExecutionOutcome outcome = executor.abandon(message(job, 0), "stuck-worker", "worker did not finish");

        assertThat(outcome.retryScheduled()).isTrue();
        Job stored = reload(job);
        assertThat(stored.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(stored.getRetryCount()).isEqualTo(1);
        assertThat(stored.getStatusMessage()).isEqualTo("Retry 1/3 in 60s: worker did not finish");
    }
}
