package im.arun.tlfextract.model;

import lombok.Value;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Text of a single source page: the raw extractor output plus its trimmed,
 * non-empty lines in reading order.
 */
@Value
public class PageText {
    int pageNumber;
    String text;
    List<String> lines;

    /**
     * Build the page text, splitting on any line terminator and dropping lines
     * that are blank after {@link #trimLine(String)}.
     *
     * @param pageNumber 1-based page number in the source document
     * @param text Raw extractor output, may be null
     * @return Page text
     */
    public static PageText of(int pageNumber, String text) {
        String raw = text != null ? text : "";
        List<String> lines = Arrays.stream(raw.split("\\R"))
                .map(PageText::trimLine)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toUnmodifiableList());
        return new PageText(pageNumber, raw, lines);
    }

    /**
     * Trim leading and trailing whitespace, including the Unicode space
     * separators ({@code U+00A0}, {@code U+2007}, {@code U+202F}) that
     * {@link String#strip()} keeps.
     *
     * @param line Line to trim
     * @return Trimmed line
     */
    public static String trimLine(String line) {
        int start = 0;
        int end = line.length();
        while (start < end && isBlankChar(line.charAt(start))) {
            start++;
        }
        while (end > start && isBlankChar(line.charAt(end - 1))) {
            end--;
        }
        return line.substring(start, end);
    }

    private static boolean isBlankChar(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    /**
     * First {@code count} lines (fewer if the page is shorter).
     */
    public List<String> head(int count) {
        return lines.subList(0, Math.min(count, lines.size()));
    }

    /**
     * Last {@code count} lines (fewer if the page is shorter).
     */
    public List<String> tail(int count) {
        return lines.subList(Math.max(0, lines.size() - count), lines.size());
    }
}
