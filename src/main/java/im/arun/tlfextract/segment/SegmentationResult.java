package im.arun.tlfextract.segment;

import im.arun.tlfextract.model.TlfKind;
import im.arun.tlfextract.model.TlfRecord;
import lombok.Value;

import java.util.List;

@Value
public class SegmentationResult {
    List<TlfRecord> records;
    int warnings;
    /** Page holding the Section 15/16 heading, or null if the document simply ended. */
    Integer terminationPage;

    public int getTotalTlfPages() {
        return records.stream().mapToInt(TlfRecord::getPageCount).sum();
    }

    public long count(TlfKind kind) {
        return records.stream().filter(r -> r.getKind() == kind).count();
    }
}
