package im.arun.tlfextract.classify;

import im.arun.tlfextract.config.ExtractorConfig;
import im.arun.tlfextract.model.PageText;

import java.util.Locale;

/**
 * Detects the "15. References" / "16. Appendices" headings that close the TLF section.
 */
public class TerminationDetector {
    private final int scanLines;

    public TerminationDetector() {
        this(new ExtractorConfig());
    }

    public TerminationDetector(ExtractorConfig config) {
        this.scanLines = config.getTerminationScanLines();
    }

    /**
     * @param page Page text
     * @return true if one of the top lines is a Section 15 or 16 heading
     */
    public boolean isTermination(PageText page) {
        for (String line : page.head(scanLines)) {
            if (isTerminationHeading(line)) {
                return true;
            }
        }
        return false;
    }

    boolean isTerminationHeading(String line) {
        String upper = line.toUpperCase(Locale.ROOT);
        return upper.equals("15.")
                || upper.equals("16.")
                || upper.startsWith("15. REFERENCE")
                || upper.startsWith("16. APPEND");
    }
}
