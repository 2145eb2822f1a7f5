package im.arun.tlfextract.pdf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the plain text of a page range, one page after another, with a
 * {@code --- Page n ---} separator before every page but the first.
 */
public class PageTextWriter {
    private static final Logger logger = LoggerFactory.getLogger(PageTextWriter.class);

    static final String FAILURE_MARKER = "[TEXT EXTRACTION FAILED ON PAGE %d]";

    /**
     * Text of pages {@code firstPage..lastPage} with separators. {@code n} in
     * the separator counts pages within the range, starting at 2.
     */
    public String render(SourceDocument document, int firstPage, int lastPage) throws IOException {
        StringBuilder text = new StringBuilder();
        for (int page = firstPage; page <= lastPage; page++) {
            text.append(document.getText(page));
            if (page < lastPage) {
                text.append(String.format("\n--- Page %d ---\n", page - firstPage + 2));
            }
        }
        return text.toString();
    }

    /**
     * Write the rendered text to {@code target}. A failed extraction leaves a
     * placeholder marker in the file instead of aborting the run.
     *
     * @return true if the real text was written
     */
    public boolean write(SourceDocument document, int firstPage, int lastPage, Path target) throws IOException {
        try {
            Files.writeString(target, render(document, firstPage, lastPage), StandardCharsets.UTF_8);
            return true;
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to extract text to {}: {}", target, e.getMessage());
            Files.writeString(target, String.format(FAILURE_MARKER, firstPage), StandardCharsets.UTF_8);
            return false;
        }
    }
}
