package im.arun.finstream.config;

import im.arun.finstream.layout.AnchorPolicy;
import im.arun.finstream.layout.ColumnMatchPolicy;
import im.arun.finstream.text.NumericMatchPolicy;
import lombok.Data;

/**
 * Tuning parameters of one document run. Tolerances are in page units (points).
 */
@Data
public class StreamerConfig {
    /** Largest horizontal gap still treated as the same column. */
    private float horizontalTolerance = 20f;
    /** Largest vertical gap still treated as the same row. */
    private float verticalTolerance = 3f;
    private boolean maskValues = false;
    private char maskChar = 'X';
    private NumericMatchPolicy numericMatchPolicy = NumericMatchPolicy.EMBEDDED;
    private ColumnMatchPolicy columnMatchPolicy = ColumnMatchPolicy.FIRST_MATCH;
    private AnchorPolicy anchorPolicy = AnchorPolicy.FIRST_MEMBER;
    /** Glyph gap that splits a word during PDF extraction. */
    private float wordGapTolerance = 3f;
    private String model = "gpt-4o";
    private boolean countLlmTokens = true;
}
