package im.arun.tlfextract.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of manifest.csv. Column order is part of the output contract.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"id", "type", "title", "file", "pages_in_source_start", "pages_in_source_end",
        "page_count", "population", "source_program"})
public class ManifestRow {

    @JsonProperty("id")
    private String id;

    @JsonProperty("type")
    private String type;

    @JsonProperty("title")
    private String title;

    @JsonProperty("file")
    private String file;

    @JsonProperty("pages_in_source_start")
    private int pagesInSourceStart;

    @JsonProperty("pages_in_source_end")
    private int pagesInSourceEnd;

    @JsonProperty("page_count")
    private int pageCount;

    @JsonProperty("population")
    private String population;

    @JsonProperty("source_program")
    private String sourceProgram;
}
