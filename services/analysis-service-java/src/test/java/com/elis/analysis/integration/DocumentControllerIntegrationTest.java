package com.elis.analysis.integration;

import com.elis.analysis.dto.AuthResponse;
import com.elis.analysis.dto.RegisterRequest;
import com.elis.analysis.messaging.JobPublisher;
import com.elis.analysis.model.Document;
import com.elis.analysis.model.Image;
import com.elis.analysis.model.ImageSource;
import com.elis.analysis.model.Job;
import com.elis.analysis.model.JobKind;
import com.elis.analysis.model.User;
import com.elis.analysis.repository.DocumentRepository;
import com.elis.analysis.repository.ImageRepository;
import com.elis.analysis.repository.JobRepository;
import com.elis.analysis.repository.UserRepository;
import com.elis.analysis.support.TestData;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.springframework.security.test.web.servlet.setup.SecurityMockMvcConfigurers.springSecurity;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class DocumentControllerIntegrationTest {

    private static final byte[] PDF = "%PDF-1.4 test".getBytes(StandardCharsets.US_ASCII);

    private MockMvc mockMvc;

    @Autowired
    private WebApplicationContext context;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private DocumentRepository documentRepository;

    @Autowired
    private ImageRepository imageRepository;

    @Autowired
    private JobRepository jobRepository;

    @Autowired
    private TestData testData;

    @MockitoBean
    private JobPublisher jobPublisher;

    private String userToken;
    private String otherUserToken;

    @BeforeEach
    void setUp() throws Exception {
        mockMvc = MockMvcBuilders
                .webAppContextSetup(context)
                .apply(springSecurity())
                .build();
        testData.clear();

        userToken = registerAndGetToken("owner");
        otherUserToken = registerAndGetToken("stranger");
    }

    private String registerAndGetToken(String username) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new RegisterRequest(username, username + "@example.com", "password123"))))
                .andExpect(status().isCreated())
                .andReturn();
        return objectMapper.readValue(result.getResponse().getContentAsString(), AuthResponse.class).accessToken();
    }

    private JsonNode upload(String filename) throws Exception {
        MvcResult result = mockMvc.perform(multipart("/documents")
                        .file(new MockMultipartFile("file", filename, "application/pdf", PDF))
                        .header("Authorization", "Bearer " + userToken))
                .andExpect(status().isCreated())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    void upload_storesFileAndQueuesExtraction() throws Exception {
        JsonNode body = upload("paper.pdf");

        assertThat(body.at("/document/filename").asText()).isEqualTo("paper.pdf");
        assertThat(body.at("/document/fileSize").asLong()).isEqualTo(PDF.length);
        assertThat(body.at("/extractionJob/kind").asText()).isEqualTo("EXTRACT_IMAGES");
        assertThat(body.at("/extractionJob/status").asText()).isEqualTo("QUEUED");

        UUID documentId = UUID.fromString(body.at("/document/id").asText());
        Document stored = documentRepository.findById(documentId).orElseThrow();
        assertThat(Files.readAllBytes(Path.of(stored.getFilePath()))).isEqualTo(PDF);
        verify(jobPublisher).publishJob(any(UUID.class), eq(JobKind.EXTRACT_IMAGES), eq(0));
    }

    @Test
    void upload_notPdf_returns400() throws Exception {
        mockMvc.perform(multipart("/documents")
                        .file(new MockMultipartFile("file", "notes.txt", "text/plain", "hello".getBytes(StandardCharsets.UTF_8)))
                        .header("Authorization", "Bearer " + userToken))
                .andExpect(status().isBadRequest());

        assertThat(documentRepository.count()).isZero();
        assertThat(jobRepository.count()).isZero();
    }

    @Test
    void upload_noToken_returns403() throws Exception {
        mockMvc.perform(multipart("/documents")
                        .file(new MockMultipartFile("file", "paper.pdf", "application/pdf", PDF)))
                .andExpect(status().isForbidden());
    }

    @Test
    void getDocument_otherUser_returns404() throws Exception {
        String documentId = upload("paper.pdf").at("/document/id").asText();

        mockMvc.perform(get("/documents/" + documentId)
                        .header("Authorization", "Bearer " + userToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(documentId));

        mockMvc.perform(get("/documents/" + documentId)
                        .header("Authorization", "Bearer " + otherUserToken))
                .andExpect(status().isNotFound());
    }

    @Test
    void listDocuments_returnsOnlyOwn() throws Exception {
        upload("a.pdf");
        upload("b.pdf");

        mockMvc.perform(get("/documents")
                        .header("Authorization", "Bearer " + userToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));

        mockMvc.perform(get("/documents")
                        .header("Authorization", "Bearer " + otherUserToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void listExtractedImages_sortedByFilename() throws Exception {
        UUID documentId = UUID.fromString(upload("paper.pdf").at("/document/id").asText());
        User owner = userRepository.findByUsernameOrEmail("owner", "owner").orElseThrow();
        extractedImage(owner, documentId, "page2_img1.png");
        extractedImage(owner, documentId, "page1_img1.png");

        mockMvc.perform(get("/documents/" + documentId + "/images")
                        .header("Authorization", "Bearer " + userToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].filename").value("page1_img1.png"))
                .andExpect(jsonPath("$[0].sourceType").value("EXTRACTED"));
    }

    @Test
    void deleteDocument_cascadesToDerivedRecordsAndFiles() throws Exception {
        UUID documentId = UUID.fromString(upload("paper.pdf").at("/document/id").asText());
        User owner = userRepository.findByUsernameOrEmail("owner", "owner").orElseThrow();
        Image image = extractedImage(owner, documentId, "page1_img1.png");
        var derived = new Document("paper_watermark_removed_m2.pdf", "/tmp/unused.pdf", 10, owner);
        derived.setSourceDocumentId(documentId);
        derived = documentRepository.save(derived);
        jobRepository.save(new Job(JobKind.DETECT_TAMPER, image.getId(), "{}", owner, 3));
        Path documentFile = Path.of(documentRepository.findById(documentId).orElseThrow().getFilePath());

        mockMvc.perform(delete("/documents/" + documentId)
                        .header("Authorization", "Bearer " + userToken))
                .andExpect(status().isNoContent());

        assertThat(documentRepository.findById(documentId)).isEmpty();
        assertThat(documentRepository.findById(derived.getId())).isEmpty();
        assertThat(imageRepository.findById(image.getId())).isEmpty();
        assertThat(jobRepository.count()).isZero();
        assertThat(documentFile).doesNotExist();
    }

    @Test
    void deleteDocument_otherUser_returns404() throws Exception {
        String documentId = upload("paper.pdf").at("/document/id").asText();

        mockMvc.perform(delete("/documents/" + documentId)
                        .header("Authorization", "Bearer " + otherUserToken))
                .andExpect(status().isNotFound());

        assertThat(documentRepository.count()).isEqualTo(1);
    }

    private Image extractedImage(User owner, UUID documentId, String filename) {
        var image = new Image(filename, "/tmp/" + filename, 100, ImageSource.EXTRACTED, owner);
        image.setDocumentId(documentId);
        return imageRepository.save(image);
    }
}
