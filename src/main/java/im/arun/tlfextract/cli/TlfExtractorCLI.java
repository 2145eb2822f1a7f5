package im.arun.tlfextract.cli;

import im.arun.tlfextract.config.ConfigLoader;
import im.arun.tlfextract.config.ExtractorConfig;
import im.arun.tlfextract.exception.TlfExtractionException;
import im.arun.tlfextract.pdf.PdfBoxDocumentLoader;
import im.arun.tlfextract.pdf.PdfDocumentLoader;
import im.arun.tlfextract.service.ExtractionOptions;
import im.arun.tlfextract.service.ExtractionSummary;
import im.arun.tlfextract.service.TlfExtractionService;
import im.arun.tlfextract.verification.ManifestValidator;
import im.arun.tlfextract.verification.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the TLF extractor using Picocli.
 */
@Command(
    name = "tlf-extractor",
    description = "Extract Tables/Figures from an ICH E3 clinical study report PDF",
    mixinStandardHelpOptions = true,
    version = "TLF Extractor 1.0"
)
public class TlfExtractorCLI implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(TlfExtractorCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"--input"}, description = "Path to the input PDF file")
    private String inputPath;

    @Option(names = {"--output"}, description = "Directory to save the extracted outputs", required = true)
    private String outputPath;

    @Option(names = {"--verbose"}, description = "Print verbose extraction steps")
    private boolean verbose;

    @Option(names = {"--dry-run"}, description = "Detect without creating files")
    private boolean dryRun;

    @Option(names = {"--validate"}, description = "Run validation on output directory")
    private boolean validate;

    @Option(names = {"--no-text"}, description = "Skip text extraction")
    private boolean noText;

    @Option(names = {"--config"}, description = "Optional YAML configuration file")
    private String configPath;

    private final PdfDocumentLoader documentLoader;

    public TlfExtractorCLI() {
        this(new PdfBoxDocumentLoader());
    }

    TlfExtractorCLI(PdfDocumentLoader documentLoader) {
        this.documentLoader = documentLoader;
    }

    @Override
    public Integer call() {
        LoggingConfigurator.configure(verbose);
        Path outputDir = Paths.get(outputPath);

        if (inputPath == null) {
            if (!validate) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "--input is required unless running standalone --validate");
            }
            return runValidation(outputDir);
        }

        Map<String, Object> overrides = new HashMap<>();
        if (noText) {
            overrides.put("writeText", false);
        }
        ExtractorConfig config = new ConfigLoader(configPath).load(overrides);

        ExtractionOptions options = ExtractionOptions.builder()
                .input(Paths.get(inputPath))
                .outputDir(outputDir)
                .dryRun(dryRun)
                .build();

        ExtractionSummary summary;
        try {
            summary = new TlfExtractionService(config, documentLoader).extract(options);
        } catch (TlfExtractionException e) {
            logger.error(e.getMessage());
            return 1;
        } catch (IOException e) {
            logger.error("Error processing document: {}", e.getMessage(), e);
            return 1;
        }

        PrintWriter out = spec.commandLine().getOut();
        out.println();
        print(out, summary.render());
        if (dryRun) {
            out.println("Dry run: no files written.");
        }
        out.flush();

        if (validate && !dryRun) {
            return runValidation(outputDir);
        }
        return 0;
    }

    private int runValidation(Path outputDir) {
        ValidationReport report;
        try {
            report = new ManifestValidator(documentLoader).validate(outputDir);
        } catch (TlfExtractionException e) {
            logger.error(e.getMessage());
            return 1;
        }
        PrintWriter out = spec.commandLine().getOut();
        out.println();
        print(out, report.render());
        out.flush();
        return 0;
    }

    private static void print(PrintWriter out, List<String> lines) {
        lines.forEach(out::println);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TlfExtractorCLI()).execute(args);
        System.exit(exitCode);
    }
}
