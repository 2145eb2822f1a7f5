package im.arun.tlfextract.exception;

/** Thrown when the source is too short to hold a narrative body and a TLF section. */
public class InsufficientPagesException extends TlfExtractionException {

    private final int pageCount;
    private final int minimumPages;

    public InsufficientPagesException(int pageCount, int minimumPages) {
        super(String.format("Document has too few pages (%d). Cannot extract CSR; at least %d required.",
                pageCount, minimumPages));
        this.pageCount = pageCount;
        this.minimumPages = minimumPages;
    }

    public int getPageCount() {
        return pageCount;
    }

    public int getMinimumPages() {
        return minimumPages;
    }
}
