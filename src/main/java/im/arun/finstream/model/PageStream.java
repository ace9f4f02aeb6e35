package im.arun.finstream.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * The annotated stream of one page together with the layout facts it was built from.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PageStream {

    @JsonProperty("page_number")
    private int pageNumber;

    @JsonProperty("baselines")
    private List<Float> baselines;

    @JsonProperty("row_count")
    private int rowCount;

    @JsonProperty("value_count")
    private int valueCount;

    @JsonProperty("llm_token_count")
    private Integer llmTokenCount;

    @JsonProperty("lines")
    private List<String> lines;

    @JsonProperty("column_count")
    public int getColumnCount() {
        return baselines == null ? 0 : baselines.size();
    }

    @JsonProperty("header")
    public String getHeader() {
        return String.format("=== PAGE %d [Detected %d Columns] ===", pageNumber, getColumnCount());
    }

    /**
     * Header followed by the page's lines, newline separated.
     */
    @JsonIgnore
    public String render() {
        StringBuilder text = new StringBuilder(getHeader());
        text.append('\n');
        text.append(String.join("\n", lines));
        return text.toString();
    }
}
