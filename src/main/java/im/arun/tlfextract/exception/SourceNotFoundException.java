package im.arun.tlfextract.exception;

import java.nio.file.Path;

/** Thrown when the source PDF does not exist. */
public class SourceNotFoundException extends TlfExtractionException {

    private final Path source;

    public SourceNotFoundException(Path source) {
        super("Input file not found: " + source);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
