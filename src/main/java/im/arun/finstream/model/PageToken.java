package im.arun.finstream.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.Objects;

/**
 * One recognized text unit on a page: its content and the origin of its bounding box.
 * Coordinates are in page units, {@code top} measured downwards from the page's top edge.
 */
@Value
public class PageToken {

    @JsonProperty("text")
    String text;

    @JsonProperty("x0")
    float x0;

    @JsonProperty("top")
    float top;

    @JsonCreator
    public PageToken(@JsonProperty("text") String text,
                     @JsonProperty("x0") float x0,
                     @JsonProperty("top") float top) {
        this.text = Objects.requireNonNull(text, "token text must not be null");
        if (!Float.isFinite(x0) || !Float.isFinite(top)) {
            throw new IllegalArgumentException(
                String.format("token '%s' has non-finite origin (%s, %s)", text, x0, top));
        }
        this.x0 = x0;
        this.top = top;
    }

    /**
     * Left edge truncated towards zero, as rendered in the stream.
     */
    public int truncatedX() {
        return (int) x0;
    }
}
