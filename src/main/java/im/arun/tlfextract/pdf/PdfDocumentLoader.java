package im.arun.tlfextract.pdf;

import java.io.IOException;
import java.nio.file.Path;

@FunctionalInterface
public interface PdfDocumentLoader {

    SourceDocument open(Path pdfPath) throws IOException;
}
