package im.arun.tlfextract.exception;

/** Base class for errors that abort an extraction or validation run. */
public class TlfExtractionException extends RuntimeException {

    public TlfExtractionException(String message) {
        super(message);
    }

    public TlfExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
