package im.arun.tlfextract.pdf;

import im.arun.tlfextract.model.PageText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazily reads pages {@code firstPage..lastPage} of a document; a page is
 * only extracted when the iterator reaches it.
 *
 * <p>A page whose text cannot be extracted is logged and yielded as an empty
 * page, so it carries no heading and simply continues whatever TLF is open.
 */
public class PageSequence implements Iterable<PageText> {
    private static final Logger logger = LoggerFactory.getLogger(PageSequence.class);

    private final SourceDocument document;
    private final int firstPage;
    private final int lastPage;

    public PageSequence(SourceDocument document, int firstPage, int lastPage) {
        this.document = document;
        this.firstPage = firstPage;
        this.lastPage = lastPage;
    }

    @Override
    public Iterator<PageText> iterator() {
        return new Iterator<>() {
            private int next = firstPage;

            @Override
            public boolean hasNext() {
                return next <= lastPage;
            }

            @Override
            public PageText next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                int pageNumber = next++;
                return read(pageNumber);
            }
        };
    }

    private PageText read(int pageNumber) {
        try {
            return document.getPage(pageNumber);
        } catch (IOException | RuntimeException e) {
            logger.warn("Text extraction failed on page {}, treating it as a page without heading: {}",
                    pageNumber, e.getMessage());
            return PageText.of(pageNumber, "");
        }
    }
}
