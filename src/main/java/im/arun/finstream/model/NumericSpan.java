package im.arun.finstream.model;

/**
 * A numeric occurrence inside a token's text.
 *
 * @param start inclusive start offset in the source text
 * @param end   exclusive end offset in the source text
 * @param value the matched value with thousands separators removed
 */
public record NumericSpan(int start, int end, String value) {
}
