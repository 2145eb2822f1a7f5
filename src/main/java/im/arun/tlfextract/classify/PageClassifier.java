package im.arun.tlfextract.classify;

import im.arun.tlfextract.config.ExtractorConfig;
import im.arun.tlfextract.model.PageText;
import im.arun.tlfextract.model.TlfIdentity;
import im.arun.tlfextract.model.TlfKind;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads the TLF heading, population and source program off a page's text.
 * Headings live in the top lines of a page and the "Source:" footer in the
 * bottom lines, so only those windows are examined.
 */
public class PageClassifier {
    private static final Pattern HEADING_PATTERN =
            Pattern.compile("^(Table|Figure)\\s*14[.\\-][\\d.\\-]+",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern COLUMN_GAP = Pattern.compile("\\s{2,}", Pattern.UNICODE_CHARACTER_CLASS);
    private static final String POPULATION_PREFIX = "population:";
    private static final String SOURCE_PREFIX = "source:";

    private final int headingScanLines;
    private final int footerScanLines;

    public PageClassifier() {
        this(new ExtractorConfig());
    }

    public PageClassifier(ExtractorConfig config) {
        this.headingScanLines = config.getHeadingScanLines();
        this.footerScanLines = config.getFooterScanLines();
    }

    /**
     * Classify a page.
     *
     * <p>The first heading line among the top lines becomes the id, the line
     * after it the title. Population comes from a {@code Population:} line near
     * the top and the source program from the lowest {@code Source:} footer.
     *
     * @param page Page text
     * @return The TLF identity if a heading line is present in the top lines,
     *         empty otherwise
     */
    public Optional<TlfIdentity> classify(PageText page) {
        List<String> head = page.head(headingScanLines);

        int headingIndex = -1;
        for (int i = 0; i < head.size(); i++) {
            if (isHeading(head.get(i))) {
                headingIndex = i;
                break;
            }
        }
        if (headingIndex == -1) {
            return Optional.empty();
        }

        String id = head.get(headingIndex);
        TlfKind kind = id.toLowerCase(Locale.ROOT).contains("table") ? TlfKind.TABLE : TlfKind.FIGURE;

        // Title is the next line of the whole page, which may fall outside the heading window
        List<String> lines = page.getLines();
        String title = headingIndex + 1 < lines.size() ? lines.get(headingIndex + 1) : "";

        return Optional.of(new TlfIdentity(id, kind, title, findPopulation(page), findSourceProgram(page)));
    }

    /**
     * Check whether a line is a Section 14 TLF heading such as
     * {@code Table 14.1.1} or {@code Figure 14-2}.
     *
     * @param line Line of page text; surrounding whitespace is ignored
     * @return true if the line starts with a TLF heading
     */
    public boolean isHeading(String line) {
        return HEADING_PATTERN.matcher(PageText.trimLine(line)).find();
    }

    String findPopulation(PageText page) {
        for (String line : page.head(headingScanLines)) {
            if (line.toLowerCase(Locale.ROOT).startsWith(POPULATION_PREFIX)) {
                return PageText.trimLine(line.substring(line.indexOf(':') + 1));
            }
        }
        return null;
    }

    String findSourceProgram(PageText page) {
        List<String> tail = page.tail(footerScanLines);
        for (int i = tail.size() - 1; i >= 0; i--) {
            String line = tail.get(i);
            if (line.toLowerCase(Locale.ROOT).startsWith(SOURCE_PREFIX)) {
                String rest = PageText.trimLine(line.substring(SOURCE_PREFIX.length()));
                String program = COLUMN_GAP.split(rest)[0];
                return program.isEmpty() ? null : program;
            }
        }
        return null;
    }
}
