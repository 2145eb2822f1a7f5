package im.arun.tlfextract.exception;

import java.nio.file.Path;

/** Thrown when validation finds no manifest.json in the output directory. */
public class ManifestMissingException extends TlfExtractionException {

    public ManifestMissingException(Path outputDir) {
        super("Cannot validate: manifest.json not found in " + outputDir);
    }
}
