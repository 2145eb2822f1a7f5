package im.arun.tlfextract.config;

import lombok.Data;

/**
 * Layout constants for the CSR document family plus output switches.
 */
@Data
public class ExtractorConfig {
    private int narrativePageCount = 42;
    private int headingScanLines = 10;
    private int footerScanLines = 15;
    private int terminationScanLines = 20;
    private boolean writeText = true;

    /**
     * First page of the TLF section; also the minimum size of a source document.
     */
    public int getFirstTlfPage() {
        return narrativePageCount + 1;
    }
}
