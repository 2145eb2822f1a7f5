package im.arun.tlfextract.service;

import im.arun.tlfextract.classify.PageClassifier;
import im.arun.tlfextract.classify.TerminationDetector;
import im.arun.tlfextract.config.ExtractorConfig;
import im.arun.tlfextract.exception.InsufficientPagesException;
import im.arun.tlfextract.exception.SourceNotFoundException;
import im.arun.tlfextract.manifest.ManifestBuilder;
import im.arun.tlfextract.manifest.ManifestWriter;
import im.arun.tlfextract.manifest.OutputLayout;
import im.arun.tlfextract.model.Manifest;
import im.arun.tlfextract.model.TlfRecord;
import im.arun.tlfextract.pdf.PageTextWriter;
import im.arun.tlfextract.pdf.PdfDocumentLoader;
import im.arun.tlfextract.pdf.SourceDocument;
import im.arun.tlfextract.segment.SegmentationEngine;
import im.arun.tlfextract.segment.SegmentationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Splits a CSR PDF into its narrative body and TLFs and records the result
 * in a manifest.
 *
 * <p>Structural problems (missing input, too few pages) are detected before
 * anything is written. In dry-run mode the segmentation and manifest are
 * computed exactly as in a normal run but the filesystem is left untouched.
 */
public class TlfExtractionService {
    private static final Logger logger = LoggerFactory.getLogger(TlfExtractionService.class);

    private final ExtractorConfig config;
    private final PdfDocumentLoader documentLoader;
    private final SegmentationEngine segmentationEngine;
    private final ManifestBuilder manifestBuilder;
    private final ManifestWriter manifestWriter;
    private final PageTextWriter pageTextWriter;
    private final Clock clock;

    public TlfExtractionService(ExtractorConfig config, PdfDocumentLoader documentLoader) {
        this(config, documentLoader, Clock.systemUTC());
    }

    public TlfExtractionService(ExtractorConfig config, PdfDocumentLoader documentLoader, Clock clock) {
        this.config = config;
        this.documentLoader = documentLoader;
        this.segmentationEngine = new SegmentationEngine(new PageClassifier(config), new TerminationDetector(config));
        this.manifestBuilder = new ManifestBuilder(config.getNarrativePageCount());
        this.manifestWriter = new ManifestWriter(manifestBuilder);
        this.pageTextWriter = new PageTextWriter();
        this.clock = clock;
    }

    /**
     * Run one extraction.
     *
     * <p>A page whose text cannot be read, or a TLF whose files cannot be
     * written, is logged at WARN and skipped; the manifest is still produced
     * and the validator reports the missing file.
     *
     * @param options Input PDF, output directory and dry-run flag
     * @return Summary of what was found
     * @throws SourceNotFoundException if the input does not exist
     * @throws InsufficientPagesException if the input is shorter than the narrative plus one page
     * @throws IOException if the source cannot be opened or the output tree or manifest cannot be written
     */
    public ExtractionSummary extract(ExtractionOptions options) throws IOException {
        Path input = options.getInput();
        Path outputDir = options.getOutputDir();
        if (!Files.exists(input)) {
            throw new SourceNotFoundException(input);
        }

        try (SourceDocument document = documentLoader.open(input)) {
            int totalPages = document.getPageCount();
            int firstTlfPage = config.getFirstTlfPage();
            if (totalPages < firstTlfPage) {
                throw new InsufficientPagesException(totalPages, firstTlfPage);
            }

            boolean write = !options.isDryRun();
            if (write) {
                prepareDirectories(outputDir);
                writeNarrative(document, outputDir);
            }

            SegmentationResult result = segmentationEngine.segment(document.pages(firstTlfPage, totalPages));

            if (write) {
                for (TlfRecord tlf : result.getRecords()) {
                    writeTlf(document, outputDir, tlf);
                }
            }

            Manifest manifest = manifestBuilder.build(
                    result, input.getFileName().toString(), totalPages, clock.instant());
            if (write) {
                manifestWriter.write(manifest, outputDir);
            }
            return new ExtractionSummary(manifest, result);
        }
    }

    private void prepareDirectories(Path outputDir) throws IOException {
        Files.createDirectories(outputDir.resolve(OutputLayout.PDF_DIR));
        if (config.isWriteText()) {
            Files.createDirectories(outputDir.resolve(OutputLayout.TEXT_DIR));
        }
    }

    private void writeNarrative(SourceDocument document, Path outputDir) {
        int lastPage = config.getNarrativePageCount();
        logger.info("Extracting narrative body (pages 1-{})...", lastPage);
        try {
            writeRange(document, outputDir, 1, lastPage,
                    OutputLayout.narrativePdfFile(), OutputLayout.narrativeTextFile());
        } catch (IOException e) {
            logger.warn("Failed to write narrative body: {}", e.getMessage());
        }
    }

    private void writeTlf(SourceDocument document, Path outputDir, TlfRecord tlf) {
        try {
            writeRange(document, outputDir, tlf.getFirstPage(), tlf.getLastPage(),
                    tlf.getFile(), OutputLayout.textFile(tlf.getId()));
        } catch (IOException e) {
            logger.warn("Failed to write {} (pages {}-{}): {}",
                    tlf.getId(), tlf.getFirstPage(), tlf.getLastPage(), e.getMessage());
        }
    }

    private void writeRange(SourceDocument document, Path outputDir, int firstPage, int lastPage,
                            String pdfFile, String textFile) throws IOException {
        document.extractPages(firstPage, lastPage, outputDir.resolve(pdfFile));
        if (config.isWriteText()) {
            pageTextWriter.write(document, firstPage, lastPage, outputDir.resolve(textFile));
        }
    }
}
