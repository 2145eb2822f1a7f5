package im.arun.tlfextract.verification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a validation run. Every check starts out passing and is
 * flipped by the first failure recorded against it.
 */
public class ValidationReport {
    private final Map<ValidationCheck, Boolean> results = new EnumMap<>(ValidationCheck.class);
    private final List<String> failures = new ArrayList<>();

    private int tlfCount;
    private int narrativePages;
    private Integer coveredFrom;
    private Integer coveredTo;

    public ValidationReport() {
        for (ValidationCheck check : ValidationCheck.values()) {
            results.put(check, true);
        }
    }

    void fail(ValidationCheck check, String message) {
        results.put(check, false);
        failures.add("❌ " + message);
    }

    /** Flip a check without adding another message; used for secondary effects of a failure. */
    void markFailed(ValidationCheck check) {
        results.put(check, false);
    }

    void setTlfCount(int tlfCount) {
        this.tlfCount = tlfCount;
    }

    void setNarrativePages(int narrativePages) {
        this.narrativePages = narrativePages;
    }

    void setCoveredRange(int from, int to) {
        this.coveredFrom = from;
        this.coveredTo = to;
    }

    public boolean passed(ValidationCheck check) {
        return results.get(check);
    }

    public boolean isPassed() {
        return passedCount() == results.size();
    }

    public int passedCount() {
        return (int) results.values().stream().filter(Boolean::booleanValue).count();
    }

    public int totalCount() {
        return results.size();
    }

    public List<String> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    /**
     * One line per passing check, in check order.
     */
    public List<String> successLines() {
        List<String> lines = new ArrayList<>();
        if (passed(ValidationCheck.FILES_EXIST)) lines.add(ok("All " + tlfCount + " TLF files exist"));
        if (passed(ValidationCheck.FILES_NON_EMPTY)) lines.add(ok("All files non-empty"));
        if (passed(ValidationCheck.PAGE_COUNT_MATCH)) lines.add(ok("Page counts consistent"));
        if (passed(ValidationCheck.NO_PAGE_GAPS)) {
            if (coveredFrom != null) {
                lines.add(ok(String.format("No page gaps in Section 14 (pages %d-%d covered)", coveredFrom, coveredTo)));
            } else {
                lines.add(ok("No page gaps in Section 14"));
            }
        }
        if (passed(ValidationCheck.NO_PAGE_OVERLAPS)) lines.add(ok("No page overlaps"));
        if (passed(ValidationCheck.NARRATIVE_OK)) lines.add(ok("Narrative body OK (" + narrativePages + " pages)"));
        if (passed(ValidationCheck.PDFS_READABLE)) lines.add(ok("All PDFs readable"));
        return lines;
    }

    public String verdict() {
        if (isPassed()) {
            return String.format("Validation PASSED (%d/%d checks)", passedCount(), totalCount());
        }
        return String.format("Validation FAILED (%d/%d checks passed)", passedCount(), totalCount());
    }

    /**
     * Full human-readable report: successes, itemized failures, verdict.
     */
    public List<String> render() {
        List<String> lines = new ArrayList<>();
        lines.add("=== Validation ===");
        lines.addAll(successLines());
        lines.addAll(failures);
        lines.add("");
        lines.add(verdict());
        return lines;
    }

    private static String ok(String message) {
        return "✅ " + message;
    }
}
