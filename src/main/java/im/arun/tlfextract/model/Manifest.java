package im.arun.tlfextract.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Authoritative record of one extraction run: what was found in the source
 * document and where each part was written.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"source_file", "source_pages", "extraction_date", "narrative", "tlfs"})
public class Manifest {

    @JsonProperty("source_file")
    private String sourceFile;

    @JsonProperty("source_pages")
    private int sourcePages;

    @JsonProperty("extraction_date")
    private String extractionDate;

    @JsonProperty("narrative")
    private NarrativeRecord narrative;

    @JsonProperty("tlfs")
    private List<TlfRecord> tlfs;
}
