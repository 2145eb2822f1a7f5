package im.arun.tlfextract.service;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

@Value
@Builder
public class ExtractionOptions {
    Path input;
    Path outputDir;
    /** Detect only: run the full segmentation but write nothing. */
    boolean dryRun;
}
