package im.arun.tlfextract.verification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import im.arun.tlfextract.classify.PageClassifier;
import im.arun.tlfextract.classify.TerminationDetector;
import im.arun.tlfextract.exception.ManifestCorruptException;
import im.arun.tlfextract.exception.ManifestMissingException;
import im.arun.tlfextract.manifest.ManifestBuilder;
import im.arun.tlfextract.model.Manifest;
import im.arun.tlfextract.model.PageText;
import im.arun.tlfextract.pdf.PdfBoxDocumentLoader;
import im.arun.tlfextract.pdf.PdfFixtures;
import im.arun.tlfextract.segment.SegmentationEngine;
import im.arun.tlfextract.segment.SegmentationResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManifestValidatorTest {

    @TempDir
    Path outputDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ManifestValidator validator = new ManifestValidator(new PdfBoxDocumentLoader());

    @BeforeEach
    void createPdfDirectory() throws Exception {
        Files.createDirectories(outputDir.resolve("pdf"));
    }

    @Test
    void consistentOutputPassesAllChecks() throws Exception {
        writeNarrative(42);
        ArrayNode tlfs = objectMapper.createArrayNode();
        tlfs.add(tlf("Table 14.1.1", 43, 44, true));
        tlfs.add(tlf("Table 14.1.2", 45, 45, true));
        writeManifest(tlfs);

        ValidationReport report = validator.validate(outputDir);

        assertThat(report.isPassed()).isTrue();
        assertThat(report.passedCount()).isEqualTo(7);
        assertThat(report.getFailures()).isEmpty();
        assertThat(report.successLines()).contains(
                "✅ All 2 TLF files exist",
                "✅ No page gaps in Section 14 (pages 43-45 covered)",
                "✅ Narrative body OK (42 pages)");
        assertThat(report.verdict()).isEqualTo("Validation PASSED (7/7 checks)");
    }

    @Test
    void reportsGapBetweenRecords() throws Exception {
        writeNarrative(42);
        ArrayNode tlfs = objectMapper.createArrayNode();
        tlfs.add(tlf("Table A", 43, 44, true));
        tlfs.add(tlf("Table B", 46, 46, true));
        writeManifest(tlfs);

        ValidationReport report = validator.validate(outputDir);

        assertThat(report.passed(ValidationCheck.NO_PAGE_GAPS)).isFalse();
        assertThat(report.passed(ValidationCheck.NO_PAGE_OVERLAPS)).isTrue();
        assertThat(report.getFailures()).containsExactly("❌ Page gap before Table B (expected 45, got 46)");
        assertThat(report.isPassed()).isFalse();
        assertThat(report.verdict()).isEqualTo("Validation FAILED (6/7 checks passed)");
    }

    @Test
    void reportsOverlapBetweenRecords() throws Exception {
        writeNarrative(42);
        ArrayNode tlfs = objectMapper.createArrayNode();
        tlfs.add(tlf("Table A", 43, 45, true));
        tlfs.add(tlf("Table B", 45, 45, true));
        writeManifest(tlfs);

        ValidationReport report = validator.validate(outputDir);

        assertThat(report.passed(ValidationCheck.NO_PAGE_OVERLAPS)).isFalse();
        assertThat(report.passed(ValidationCheck.NO_PAGE_GAPS)).isTrue();
        assertThat(report.getFailures()).containsExactly("❌ Page overlap at Table B (expected 46, got 45)");
    }

    @Test
    void accumulatesFileProblemsWithoutStopping() throws Exception {
        writeNarrative(42);
        ArrayNode tlfs = objectMapper.createArrayNode();
        tlfs.add(tlf("Table A", 43, 43, false));
        ObjectNode empty = tlf("Table B", 44, 44, false);
        Files.createFile(outputDir.resolve(empty.get("file").asText()));
        tlfs.add(empty);
        ObjectNode wrongCount = tlf("Table C", 45, 46, false);
        PdfFixtures.writeBlankPdf(outputDir.resolve(wrongCount.get("file").asText()), 1);
        tlfs.add(wrongCount);
        ObjectNode garbage = tlf("Table D", 47, 47, false);
        Files.writeString(outputDir.resolve(garbage.get("file").asText()), "not a pdf");
        tlfs.add(garbage);
        writeManifest(tlfs);

        ValidationReport report = validator.validate(outputDir);

        assertThat(report.passed(ValidationCheck.FILES_EXIST)).isFalse();
        assertThat(report.passed(ValidationCheck.FILES_NON_EMPTY)).isFalse();
        assertThat(report.passed(ValidationCheck.PAGE_COUNT_MATCH)).isFalse();
        assertThat(report.passed(ValidationCheck.PDFS_READABLE)).isFalse();
        assertThat(report.passed(ValidationCheck.NO_PAGE_GAPS)).isTrue();
        assertThat(report.passed(ValidationCheck.NARRATIVE_OK)).isTrue();
        assertThat(report.getFailures()).hasSize(4);
        assertThat(report.getFailures().get(2))
                .isEqualTo("❌ Page count mismatch: Table_C.pdf has 1 pages but manifest says 2");
        assertThat(report.passedCount()).isEqualTo(3);
    }

    @Test
    void missingNarrativeFailsNarrativeAndExistenceChecks() throws Exception {
        writeManifest(objectMapper.createArrayNode());

        ValidationReport report = validator.validate(outputDir);

        assertThat(report.passed(ValidationCheck.NARRATIVE_OK)).isFalse();
        assertThat(report.passed(ValidationCheck.FILES_EXIST)).isFalse();
        assertThat(report.getFailures()).hasSize(1);
        assertThat(report.getFailures().get(0)).startsWith("❌ Narrative body missing: ");
    }

    @Test
    void narrativePageCountMismatchIsReported() throws Exception {
        writeNarrative(40);
        writeManifest(objectMapper.createArrayNode());

        ValidationReport report = validator.validate(outputDir);

        assertThat(report.passed(ValidationCheck.NARRATIVE_OK)).isFalse();
        assertThat(report.passed(ValidationCheck.PAGE_COUNT_MATCH)).isTrue();
        assertThat(report.getFailures()).containsExactly("❌ Narrative page count mismatch: 40 != 42");
    }

    @Test
    void missingManifestIsFatal() {
        assertThatThrownBy(() -> validator.validate(outputDir))
                .isInstanceOf(ManifestMissingException.class)
                .hasMessageContaining("manifest.json not found");
    }

    @Test
    void unparseableManifestIsFatal() throws Exception {
        Files.writeString(outputDir.resolve("manifest.json"), "{ \"tlfs\": [");

        assertThatThrownBy(() -> validator.validate(outputDir))
                .isInstanceOf(ManifestCorruptException.class);
    }

    @Test
    void manifestWithTrailingContentIsFatal() throws Exception {
        writeNarrative(42);
        writeManifest(objectMapper.createArrayNode());
        Path manifestPath = outputDir.resolve("manifest.json");
        Files.writeString(manifestPath, Files.readString(manifestPath) + "\n{}");

        assertThatThrownBy(() -> validator.validate(outputDir))
                .isInstanceOf(ManifestCorruptException.class);
    }

    @Test
    void builtManifestHasNoGapsOrOverlaps() {
        SegmentationEngine engine = new SegmentationEngine(new PageClassifier(), new TerminationDetector());
        List<PageText> pages = new ArrayList<>();
        String[] texts = {"Table 14.1.1\nA", "rows", "Table 14.1.2\nB", "Figure 14.2.1\nC", "rows", "rows",
                "Table 14.3.1\nD", "15. REFERENCES"};
        for (int i = 0; i < texts.length; i++) {
            pages.add(PageText.of(43 + i, texts[i]));
        }
        SegmentationResult result = engine.segment(pages);
        Manifest manifest = new ManifestBuilder(42).build(result, "csr.pdf", 60, Instant.now());

        ValidationReport report = new ValidationReport();
        ManifestValidator.checkPageContinuity(objectMapper.valueToTree(manifest).get("tlfs"), report);

        assertThat(report.passed(ValidationCheck.NO_PAGE_GAPS)).isTrue();
        assertThat(report.passed(ValidationCheck.NO_PAGE_OVERLAPS)).isTrue();
        assertThat(report.getFailures()).isEmpty();
    }

    private void writeNarrative(int pages) throws Exception {
        PdfFixtures.writeBlankPdf(outputDir.resolve("pdf/narrative_body.pdf"), pages);
    }

    private ObjectNode tlf(String id, int first, int last, boolean writeFile) throws Exception {
        String file = "pdf/" + id.replace(" ", "_") + ".pdf";
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", id);
        node.put("type", "table");
        node.put("title", "Title of " + id);
        node.put("file", file);
        node.putArray("pages_in_source").add(first).add(last);
        node.put("page_count", last - first + 1);
        node.put("population", "");
        if (writeFile) {
            PdfFixtures.writeBlankPdf(outputDir.resolve(file), last - first + 1);
        }
        return node;
    }

    private void writeManifest(JsonNode tlfs) throws Exception {
        ObjectNode manifest = objectMapper.createObjectNode();
        manifest.put("source_file", "csr.pdf");
        manifest.put("source_pages", 100);
        manifest.put("extraction_date", "2024-03-05T10:15:30Z");
        ObjectNode narrative = manifest.putObject("narrative");
        narrative.put("file", "pdf/narrative_body.pdf");
        narrative.putArray("pages_in_source").add(1).add(42);
        narrative.put("page_count", 42);
        manifest.set("tlfs", tlfs);
        objectMapper.writeValue(outputDir.resolve("manifest.json").toFile(), manifest);
    }
}
