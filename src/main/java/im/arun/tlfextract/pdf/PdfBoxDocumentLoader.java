package im.arun.tlfextract.pdf;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens documents with Apache PDFBox.
 */
public class PdfBoxDocumentLoader implements PdfDocumentLoader {

    @Override
    public SourceDocument open(Path pdfPath) throws IOException {
        PDDocument document = Loader.loadPDF(pdfPath.toFile());
        return new PdfBoxSourceDocument(document);
    }
}
