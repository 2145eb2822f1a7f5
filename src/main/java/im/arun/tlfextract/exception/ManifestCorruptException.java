package im.arun.tlfextract.exception;

import java.nio.file.Path;

/** Thrown when manifest.json exists but cannot be parsed. */
public class ManifestCorruptException extends TlfExtractionException {

    public ManifestCorruptException(Path manifestPath, Throwable cause) {
        super("Invalid manifest.json format: " + manifestPath, cause);
    }
}
