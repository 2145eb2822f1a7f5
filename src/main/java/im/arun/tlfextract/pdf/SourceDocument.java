package im.arun.tlfextract.pdf;

import im.arun.tlfextract.model.PageText;

import java.io.IOException;
import java.nio.file.Path;

/**
 * An open PDF as seen by the extractor: page count, per-page text and page
 * copying. Page numbers are 1-based.
 */
public interface SourceDocument extends AutoCloseable {

    int getPageCount();

    /**
     * Plain text of one page as produced by the PDF library.
     */
    String getText(int pageNumber) throws IOException;

    /**
     * Copy pages {@code firstPage..lastPage} (inclusive) into a new PDF at {@code target}.
     */
    void extractPages(int firstPage, int lastPage, Path target) throws IOException;

    @Override
    void close() throws IOException;

    default PageText getPage(int pageNumber) throws IOException {
        return PageText.of(pageNumber, getText(pageNumber));
    }

    /**
     * Lazily read pages {@code firstPage..lastPage}, tolerating per-page text failures.
     *
     * @see PageSequence
     */
    default Iterable<PageText> pages(int firstPage, int lastPage) {
        return new PageSequence(this, firstPage, lastPage);
    }
}
