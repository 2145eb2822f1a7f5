package im.arun.tlfextract.manifest;

import im.arun.tlfextract.model.NarrativeRecord;

/**
 * Relative file locations under an output directory. Paths use forward
 * slashes since they are also written into the manifest.
 */
public final class OutputLayout {
    public static final String PDF_DIR = "pdf";
    public static final String TEXT_DIR = "text";
    public static final String MANIFEST_JSON = "manifest.json";
    public static final String MANIFEST_CSV = "manifest.csv";

    private OutputLayout() {}

    /**
     * File-system safe name for a TLF id. Spaces and path separators become
     * underscores and newlines are dropped, so the name always stays a single
     * path segment.
     *
     * @param id TLF id (the full heading line)
     * @return Sanitized file name stem
     */
    public static String sanitize(String id) {
        return id.replace(" ", "_")
                .replace("/", "_")
                .replace("\\", "_")
                .replace("\r", "")
                .replace("\n", "");
    }

    public static String pdfFile(String id) {
        return PDF_DIR + "/" + sanitize(id) + ".pdf";
    }

    public static String textFile(String id) {
        return TEXT_DIR + "/" + sanitize(id) + ".txt";
    }

    public static String narrativePdfFile() {
        return PDF_DIR + "/" + NarrativeRecord.ID + ".pdf";
    }

    public static String narrativeTextFile() {
        return TEXT_DIR + "/" + NarrativeRecord.ID + ".txt";
    }
}
