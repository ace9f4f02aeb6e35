package im.arun.finstream.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * All emitted pages of one document run, in document order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentStream {

    @JsonProperty("doc_name")
    private String docName;

    @JsonProperty("page_count")
    private int pageCount;

    @JsonProperty("pages")
    private List<PageStream> pages = new ArrayList<>();

    @JsonProperty("total_rows")
    public int getTotalRows() {
        return pages.stream().mapToInt(PageStream::getRowCount).sum();
    }

    @JsonProperty("total_values")
    public int getTotalValues() {
        return pages.stream().mapToInt(PageStream::getValueCount).sum();
    }

    /**
     * The document-level text: rendered pages joined by a blank line.
     */
    @JsonProperty("stream")
    public String render() {
        return pages.stream().map(PageStream::render).collect(Collectors.joining("\n\n"));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return pages.isEmpty();
    }
}
