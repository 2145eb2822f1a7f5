package im.arun.tlfextract.segment;

/**
 * What a single page did to the scan.
 */
public enum PageOutcome {
    /** Section 15/16 heading; the page and everything after it is outside the TLF section. */
    TERMINATED,
    /** New heading: a record was opened on this page. */
    OPENED,
    /** Continuation of the open record, with or without a repeated heading. */
    EXTENDED,
    /** No heading and nothing open to attach it to. */
    ORPHANED
}
