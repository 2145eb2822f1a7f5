package im.arun.tlfextract.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.util.List;

/**
 * The narrative body: the leading block of pages before the TLF section.
 */
@Value
@JsonPropertyOrder({"file", "pages_in_source", "page_count"})
public class NarrativeRecord {
    public static final String ID = "narrative_body";
    public static final String TYPE = "narrative";

    @JsonProperty("file")
    String file;

    @JsonIgnore
    int firstPage;

    @JsonIgnore
    int lastPage;

    public static NarrativeRecord ofPages(String file, int pageCount) {
        return new NarrativeRecord(file, 1, pageCount);
    }

    @JsonProperty("pages_in_source")
    public List<Integer> getPagesInSource() {
        return List.of(firstPage, lastPage);
    }

    @JsonProperty("page_count")
    public int getPageCount() {
        return lastPage - firstPage + 1;
    }
}
