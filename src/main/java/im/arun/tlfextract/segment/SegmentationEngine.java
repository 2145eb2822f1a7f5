package im.arun.tlfextract.segment;

import im.arun.tlfextract.classify.PageClassifier;
import im.arun.tlfextract.classify.TerminationDetector;
import im.arun.tlfextract.manifest.OutputLayout;
import im.arun.tlfextract.model.PageText;
import im.arun.tlfextract.model.TlfIdentity;
import im.arun.tlfextract.model.TlfRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Folds the TLF section's pages into contiguous TLF records.
 *
 * <p>Each page either terminates the scan, opens a new record, extends the
 * open one, or is dropped. Because pages are consumed strictly in order and
 * each page touches at most one record, the resulting page ranges are
 * ordered, gap-free and non-overlapping.
 */
public class SegmentationEngine {
    private static final Logger logger = LoggerFactory.getLogger(SegmentationEngine.class);

    private final PageClassifier classifier;
    private final TerminationDetector terminationDetector;

    public SegmentationEngine(PageClassifier classifier, TerminationDetector terminationDetector) {
        this.classifier = classifier;
        this.terminationDetector = terminationDetector;
    }

    /**
     * Result of feeding one page to the state machine.
     */
    public static final class Step {
        public final ScanState next;
        public final PageOutcome outcome;

        Step(ScanState next, PageOutcome outcome) {
            this.next = next;
            this.outcome = outcome;
        }
    }

    /**
     * Transition function. Pure: no logging, no I/O.
     *
     * @param state Current scan state, never {@link ScanState#DONE}
     * @param page Next page in ascending order
     * @return The next state and what happened to the page
     * @throws IllegalStateException if the scan has already terminated
     */
    public Step step(ScanState state, PageText page) {
        if (state.isDone()) {
            throw new IllegalStateException("Scan already finished");
        }
        if (terminationDetector.isTermination(page)) {
            return new Step(ScanState.DONE, PageOutcome.TERMINATED);
        }

        Optional<TlfIdentity> identity = classifier.classify(page);
        TlfRecord current = state instanceof ScanState.RecordOpen
                ? ((ScanState.RecordOpen) state).getCurrent()
                : null;

        if (identity.isEmpty()) {
            if (current == null) {
                return new Step(state, PageOutcome.ORPHANED);
            }
            return new Step(ScanState.recordOpen(current.extend()), PageOutcome.EXTENDED);
        }

        String id = identity.get().getId();
        if (current != null && current.getId().equals(id)) {
            return new Step(ScanState.recordOpen(current.extend()), PageOutcome.EXTENDED);
        }

        TlfRecord opened = TlfRecord.open(identity.get(), page.getPageNumber(), OutputLayout.pdfFile(id));
        return new Step(ScanState.recordOpen(opened), PageOutcome.OPENED);
    }

    /**
     * Scan pages in order until a termination page or the end of input.
     *
     * <p>Pages after the termination page are never pulled from the iterable.
     *
     * @param pages TLF section pages in ascending page order; read lazily
     * @return Records in scan order, warning count and termination page
     */
    public SegmentationResult segment(Iterable<PageText> pages) {
        List<TlfRecord> records = new ArrayList<>();
        ScanState state = ScanState.NO_OPEN_RECORD;
        int warnings = 0;
        Integer terminationPage = null;

        for (PageText page : pages) {
            Step step = step(state, page);
            switch (step.outcome) {
                case TERMINATED:
                    terminationPage = page.getPageNumber();
                    logger.info("Reached Section 15/16 on page {}. Terminating TLF extraction.", terminationPage);
                    break;
                case OPENED:
                    if (!records.isEmpty()) {
                        logFound(records.get(records.size() - 1));
                    }
                    records.add(((ScanState.RecordOpen) step.next).getCurrent());
                    break;
                case EXTENDED:
                    records.set(records.size() - 1, ((ScanState.RecordOpen) step.next).getCurrent());
                    break;
                case ORPHANED:
                    logger.warn("No clear TLF ID found on page {} before any TLF started.", page.getPageNumber());
                    warnings++;
                    break;
                default:
                    throw new IllegalStateException("Unhandled outcome " + step.outcome);
            }
            state = step.next;
            if (state.isDone()) {
                break;
            }
        }

        if (!records.isEmpty()) {
            logFound(records.get(records.size() - 1));
        }
        return new SegmentationResult(Collections.unmodifiableList(records), warnings, terminationPage);
    }

    private void logFound(TlfRecord record) {
        logger.info("Found {} (Pages {}-{})", record.getId(), record.getFirstPage(), record.getLastPage());
    }
}
