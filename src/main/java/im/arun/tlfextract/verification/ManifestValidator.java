package im.arun.tlfextract.verification;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.tlfextract.exception.ManifestCorruptException;
import im.arun.tlfextract.exception.ManifestMissingException;
import im.arun.tlfextract.manifest.OutputLayout;
import im.arun.tlfextract.pdf.PdfDocumentLoader;
import im.arun.tlfextract.pdf.SourceDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Re-checks an output directory against its manifest.json.
 *
 * <p>Works from what is on disk only: the manifest is read as a plain JSON
 * tree and every referenced PDF is reopened, so damage done after the
 * extraction run is caught as well. Only a missing or unparseable manifest
 * stops validation; every other finding is recorded and the remaining
 * checks still run.
 */
public class ManifestValidator {
    private static final Logger logger = LoggerFactory.getLogger(ManifestValidator.class);

    private final PdfDocumentLoader documentLoader;
    private final ObjectMapper objectMapper;

    public ManifestValidator(PdfDocumentLoader documentLoader) {
        this.documentLoader = documentLoader;
        this.objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Validate an output directory.
     *
     * @param outputDir Directory holding manifest.json and the pdf/ and text/ trees
     * @return Report with every check's outcome and the itemized failures
     * @throws ManifestMissingException if manifest.json does not exist
     * @throws ManifestCorruptException if manifest.json is not a single JSON object
     */
    public ValidationReport validate(Path outputDir) {
        JsonNode manifest = readManifest(outputDir);
        ValidationReport report = new ValidationReport();

        validateNarrative(outputDir, manifest.path("narrative"), report);

        JsonNode tlfs = manifest.path("tlfs");
        report.setTlfCount(tlfs.size());
        checkPageContinuity(tlfs, report);
        for (JsonNode tlf : tlfs) {
            validateTlfFile(outputDir, tlf, report);
        }

        if (tlfs.size() > 0) {
            report.setCoveredRange(startPage(tlfs.get(0)), endPage(tlfs.get(tlfs.size() - 1)));
        }

        logger.info("Validated {}: {}/{} checks passed", outputDir, report.passedCount(), report.totalCount());
        return report;
    }

    private JsonNode readManifest(Path outputDir) {
        Path manifestPath = outputDir.resolve(OutputLayout.MANIFEST_JSON);
        if (!Files.exists(manifestPath)) {
            throw new ManifestMissingException(outputDir);
        }
        try {
            JsonNode manifest = objectMapper.readTree(manifestPath.toFile());
            if (manifest == null || !manifest.isObject()) {
                throw new ManifestCorruptException(manifestPath, null);
            }
            return manifest;
        } catch (IOException e) {
            throw new ManifestCorruptException(manifestPath, e);
        }
    }

    private void validateNarrative(Path outputDir, JsonNode narrative, ValidationReport report) {
        int expectedPages = narrative.path("page_count").asInt(0);
        report.setNarrativePages(expectedPages);
        if (narrative.isMissingNode() || narrative.isEmpty()) {
            return;
        }

        Path file = outputDir.resolve(narrative.path("file").asText(""));
        if (!Files.isRegularFile(file)) {
            report.fail(ValidationCheck.NARRATIVE_OK, "Narrative body missing: " + file);
            report.markFailed(ValidationCheck.FILES_EXIST);
            return;
        }
        if (sizeOf(file) == 0) {
            report.fail(ValidationCheck.NARRATIVE_OK, "Narrative body is empty: " + file);
            report.markFailed(ValidationCheck.FILES_NON_EMPTY);
            return;
        }
        try {
            int actualPages = pageCount(file);
            if (actualPages != expectedPages) {
                report.fail(ValidationCheck.NARRATIVE_OK,
                        String.format("Narrative page count mismatch: %d != %d", actualPages, expectedPages));
            }
        } catch (IOException | RuntimeException e) {
            report.fail(ValidationCheck.NARRATIVE_OK, "Narrative body is unreadable: " + file);
            report.markFailed(ValidationCheck.PDFS_READABLE);
        }
    }

    /**
     * Walk the TLFs in manifest order; each must start on the page after the
     * previous one ended.
     */
    static void checkPageContinuity(JsonNode tlfs, ValidationReport report) {
        Integer expectedNextPage = null;
        for (JsonNode tlf : tlfs) {
            int start = startPage(tlf);
            if (expectedNextPage != null) {
                if (start > expectedNextPage) {
                    report.fail(ValidationCheck.NO_PAGE_GAPS, String.format("Page gap before %s (expected %d, got %d)",
                            tlf.path("id").asText(), expectedNextPage, start));
                } else if (start < expectedNextPage) {
                    report.fail(ValidationCheck.NO_PAGE_OVERLAPS, String.format("Page overlap at %s (expected %d, got %d)",
                            tlf.path("id").asText(), expectedNextPage, start));
                }
            }
            expectedNextPage = endPage(tlf) + 1;
        }
    }

    private void validateTlfFile(Path outputDir, JsonNode tlf, ValidationReport report) {
        String id = tlf.path("id").asText();
        Path file = outputDir.resolve(tlf.path("file").asText(""));
        int expectedPages = tlf.path("page_count").asInt(0);

        if (!Files.isRegularFile(file)) {
            report.fail(ValidationCheck.FILES_EXIST, "File missing for " + id + ": " + file);
            return;
        }
        if (sizeOf(file) == 0) {
            report.fail(ValidationCheck.FILES_NON_EMPTY, "File empty for " + id + ": " + file);
            return;
        }
        try {
            int actualPages = pageCount(file);
            if (actualPages != expectedPages) {
                report.fail(ValidationCheck.PAGE_COUNT_MATCH, String.format(
                        "Page count mismatch: %s has %d pages but manifest says %d",
                        file.getFileName(), actualPages, expectedPages));
            }
        } catch (IOException | RuntimeException e) {
            report.fail(ValidationCheck.PDFS_READABLE, "File unreadable for " + id + ": " + file);
        }
    }

    private int pageCount(Path file) throws IOException {
        try (SourceDocument document = documentLoader.open(file)) {
            return document.getPageCount();
        }
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            logger.warn("Cannot stat {}: {}", file, e.getMessage());
            return 0;
        }
    }

    private static int startPage(JsonNode tlf) {
        return tlf.path("pages_in_source").path(0).asInt(0);
    }

    private static int endPage(JsonNode tlf) {
        return tlf.path("pages_in_source").path(1).asInt(0);
    }
}
