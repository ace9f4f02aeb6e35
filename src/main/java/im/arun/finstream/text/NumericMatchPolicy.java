package im.arun.finstream.text;

/**
 * Which parts of a token's text are treated as numeric values.
 */
public enum NumericMatchPolicy {
    /**
     * Every signed digit run inside the text, surrounding text kept in place.
     */
    EMBEDDED,
    /**
     * Only tokens whose whole text is a signed integer or decimal.
     */
    WHOLE_TOKEN
}
