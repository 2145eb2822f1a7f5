package im.arun.tlfextract.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * {@link SourceDocument} backed by a PDFBox {@link PDDocument}. Not thread-safe.
 */
public class PdfBoxSourceDocument implements SourceDocument {
    private static final Logger logger = LoggerFactory.getLogger(PdfBoxSourceDocument.class);

    private final PDDocument document;
    private final PDFTextStripper stripper;

    public PdfBoxSourceDocument(PDDocument document) {
        this.document = document;
        this.stripper = new PDFTextStripper();
    }

    @Override
    public int getPageCount() {
        return document.getNumberOfPages();
    }

    @Override
    public String getText(int pageNumber) throws IOException {
        stripper.setStartPage(pageNumber);
        stripper.setEndPage(pageNumber);
        return stripper.getText(document);
    }

    @Override
    public void extractPages(int firstPage, int lastPage, Path target) throws IOException {
        // The source must stay open until the copy is saved; imported pages share its resources
        try (PDDocument part = new PDDocument()) {
            for (int i = firstPage; i <= lastPage; i++) {
                part.importPage(document.getPage(i - 1));
            }
            part.save(target.toFile());
        }
        logger.debug("Saved pages {}-{} to {}", firstPage, lastPage, target);
    }

    @Override
    public void close() throws IOException {
        document.close();
    }
}
