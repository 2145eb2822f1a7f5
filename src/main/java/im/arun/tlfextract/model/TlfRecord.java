package im.arun.tlfextract.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One detected Table or Figure and the contiguous run of source pages it
 * occupies. Page numbers are 1-based and inclusive.
 */
@Value
@Builder(toBuilder = true)
@JsonPropertyOrder({"id", "type", "title", "file", "pages_in_source", "page_count", "population", "source_program"})
public class TlfRecord {

    @JsonProperty("id")
    String id;

    @JsonProperty("type")
    TlfKind kind;

    @JsonProperty("title")
    String title;

    @JsonProperty("file")
    String file;

    @JsonIgnore
    int firstPage;

    @JsonIgnore
    int lastPage;

    @JsonProperty("page_count")
    int pageCount;

    @JsonProperty("population")
    String population;

    @JsonProperty("source_program")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    String sourceProgram;

    /**
     * Opens a single-page record for a freshly classified heading page.
     */
    public static TlfRecord open(TlfIdentity identity, int pageNumber, String file) {
        return TlfRecord.builder()
                .id(identity.getId())
                .kind(identity.getKind())
                .title(identity.getTitle())
                .file(file)
                .firstPage(pageNumber)
                .lastPage(pageNumber)
                .pageCount(1)
                .population(identity.getPopulation() != null ? identity.getPopulation() : "")
                .sourceProgram(identity.getSourceProgram())
                .build();
    }

    /**
     * Returns this record grown by the page that follows it.
     */
    public TlfRecord extend() {
        return toBuilder()
                .lastPage(lastPage + 1)
                .pageCount(pageCount + 1)
                .build();
    }

    @JsonProperty("pages_in_source")
    public List<Integer> getPagesInSource() {
        return List.of(firstPage, lastPage);
    }
}
