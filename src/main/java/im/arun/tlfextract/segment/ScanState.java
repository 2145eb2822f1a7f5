package im.arun.tlfextract.segment;

import im.arun.tlfextract.model.TlfRecord;

/**
 * State of the page scan: no TLF seen yet, a TLF currently open, or finished.
 */
public abstract class ScanState {

    public static final ScanState NO_OPEN_RECORD = new NoOpenRecord();
    public static final ScanState DONE = new Done();

    private ScanState() {}

    public static ScanState recordOpen(TlfRecord record) {
        return new RecordOpen(record);
    }

    public boolean isDone() {
        return false;
    }

    public static final class NoOpenRecord extends ScanState {
        private NoOpenRecord() {}

        @Override
        public String toString() {
            return "NoOpenRecord";
        }
    }

    public static final class RecordOpen extends ScanState {
        private final TlfRecord current;

        private RecordOpen(TlfRecord current) {
            this.current = current;
        }

        public TlfRecord getCurrent() {
            return current;
        }

        @Override
        public String toString() {
            return "RecordOpen(" + current.getId() + ")";
        }
    }

    public static final class Done extends ScanState {
        private Done() {}

        @Override
        public boolean isDone() {
            return true;
        }

        @Override
        public String toString() {
            return "Done";
        }
    }
}
