package im.arun.tlfextract.verification;

/**
 * Independent consistency checks run against an output directory.
 */
public enum ValidationCheck {
    FILES_EXIST("files_exist"),
    FILES_NON_EMPTY("files_non_empty"),
    PAGE_COUNT_MATCH("page_count_match"),
    NO_PAGE_GAPS("no_page_gaps"),
    NO_PAGE_OVERLAPS("no_page_overlaps"),
    NARRATIVE_OK("narrative_ok"),
    PDFS_READABLE("pdfs_readable");

    private final String key;

    ValidationCheck(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
