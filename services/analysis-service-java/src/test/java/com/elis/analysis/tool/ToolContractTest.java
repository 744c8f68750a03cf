package com.elis.analysis.tool;

import com.elis.analysis.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolContractTest {

    private final WatermarkRemovalContract watermark = new WatermarkRemovalContract();
    private final TamperDetectionContract trufor = new TamperDetectionContract();
    private final PdfExtractorContract extractor = new PdfExtractorContract();

    @Test
    void normalizeOptions_fillsDefaults() throws ConfigurationException {
        assertThat(watermark.normalizeOptions(null)).containsExactly(Map.entry("aggressiveness", "2"));
        assertThat(trufor.normalizeOptions(Map.of())).containsExactly(Map.entry("save_noiseprint", "false"));
        assertThat(extractor.normalizeOptions(Map.of())).isEmpty();
    }

    @Test
    void normalizeOptions_rejectsUnknownAndOutOfRangeValues() {
        assertThatThrownBy(() -> watermark.normalizeOptions(Map.of("aggressiveness", "4")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("aggressiveness: must be one of [1, 2, 3], got 4");
        assertThatThrownBy(() -> extractor.normalizeOptions(Map.of("dpi", "300")))
                .isInstanceOf(ConfigurationException.class)
                .hasFieldOrPropertyWithValue("field", "dpi");
    }

    @Test
    void watermarkArguments_nameOutputAfterInputAndMode() {
        assertThat(watermark.arguments(Path.of("/data/report.v2.pdf"), Map.of("aggressiveness", "3")))
                .containsExactly("-i", "/INPUT/report.v2.pdf", "-o", "/OUTPUT/report.v2_watermark_removed_m3.pdf", "-m", "3");
    }

    @Test
    void isArtifact_matchesExtensionCaseInsensitively() {
        assertThat(extractor.isArtifact(Path.of("page1_img1.PNG"))).isTrue();
        assertThat(extractor.isArtifact(Path.of("extract.log"))).isFalse();
        assertThat(trufor.isArtifact(Path.of("noiseprint.npz"))).isTrue();
        assertThat(watermark.isArtifact(Path.of("README"))).isFalse();
    }

    @Test
    void catalog_resolvesConfiguredImages() {
        ToolCatalog catalog = new ToolCatalog(new ToolProperties("docker", Map.of("trufor", "registry.local/trufor:7"),
                16384, Duration.ofSeconds(30)));

        assertThat(catalog.ref("trufor").image()).isEqualTo("registry.local/trufor:7");
        assertThat(catalog.ref("pdf-extractor").image()).isEqualTo("pdf-extractor:latest");
        assertThatThrownBy(() -> catalog.ref("sleep")).isInstanceOf(IllegalArgumentException.class);
    }
}
