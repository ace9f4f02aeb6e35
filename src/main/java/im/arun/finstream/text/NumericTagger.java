package im.arun.finstream.text;

import im.arun.finstream.model.NumericSpan;
import im.arun.finstream.model.RunCounters;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds numeric values in normalized token text and replaces each with a
 * {@code <v_NNN:payload>} marker carrying a run-unique identifier.
 *
 * <p>Span detection ({@link #findSpans}) is pure. Identifiers are drawn from the run's
 * {@link RunCounters} only in {@link #tag}, one per span, left to right.
 */
public class NumericTagger {
    static final String MASKED_PAYLOAD = "NUMERIC";
    static final char DEFAULT_MASK_CHAR = 'X';

    private static final Pattern EMBEDDED_NUMBER =
        Pattern.compile("[-△▲]?[0-9０-９](?:[0-9０-９,，.．]*[0-9０-９])?[%％]?");
    private static final Pattern WHOLE_NUMBER =
        Pattern.compile("-?[0-9０-９]+(?:[.．][0-9０-９]+)?");

    private final NumericMatchPolicy matchPolicy;
    private final boolean maskValues;
    private final char maskChar;

    public NumericTagger() {
        this(NumericMatchPolicy.EMBEDDED, false, DEFAULT_MASK_CHAR);
    }

    public NumericTagger(NumericMatchPolicy matchPolicy, boolean maskValues, char maskChar) {
        if (Character.isDigit(maskChar)) {
            throw new IllegalArgumentException("mask character must not be a digit: " + maskChar);
        }
        this.matchPolicy = matchPolicy;
        this.maskValues = maskValues;
        this.maskChar = maskChar;
    }

    /**
     * Locate numeric values in {@code text} without assigning identifiers.
     *
     * @return spans in ascending, non-overlapping order
     */
    public List<NumericSpan> findSpans(String text) {
        List<NumericSpan> spans = new ArrayList<>();
        if (matchPolicy == NumericMatchPolicy.WHOLE_TOKEN) {
            if (WHOLE_NUMBER.matcher(text).matches()) {
                spans.add(new NumericSpan(0, text.length(), text));
            }
            return spans;
        }

        Matcher matcher = EMBEDDED_NUMBER.matcher(text);
        while (matcher.find()) {
            String value = TextNormalizer.stripThousandsSeparators(
                TextNormalizer.replaceSignGlyphs(matcher.group()));
            spans.add(new NumericSpan(matcher.start(), matcher.end(), value));
        }
        return spans;
    }

    /**
     * Replace every numeric value in {@code text} with its marker.
     * Consumes one value id from {@code counters} per span.
     */
    public String tag(String text, RunCounters counters) {
        List<NumericSpan> spans = findSpans(text);
        if (spans.isEmpty()) {
            return text;
        }

        StringBuilder tagged = new StringBuilder(text.length() + spans.size() * 8);
        int cursor = 0;
        for (NumericSpan span : spans) {
            tagged.append(text, cursor, span.start());
            tagged.append(marker(counters.nextValueId(), payloadOf(span)));
            cursor = span.end();
        }
        tagged.append(text, cursor, text.length());
        return tagged.toString();
    }

    String payloadOf(NumericSpan span) {
        if (!maskValues) {
            return span.value();
        }
        if (matchPolicy == NumericMatchPolicy.WHOLE_TOKEN) {
            return MASKED_PAYLOAD;
        }
        return maskDigits(span.value());
    }

    private String maskDigits(String value) {
        StringBuilder masked = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            masked.append(isDigit(c) ? maskChar : c);
        }
        return masked.toString();
    }

    private static boolean isDigit(char c) {
        return (c >= '0' && c <= '9') || (c >= '０' && c <= '９');
    }

    static String marker(int id, String payload) {
        return String.format("<v_%03d:%s>", id, payload);
    }

    public NumericMatchPolicy getMatchPolicy() {
        return matchPolicy;
    }

    public boolean isMaskValues() {
        return maskValues;
    }
}
