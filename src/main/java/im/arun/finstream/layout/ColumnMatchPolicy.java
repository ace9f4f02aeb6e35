package im.arun.finstream.layout;

/**
 * How a token's left edge is mapped to a baseline.
 */
public enum ColumnMatchPolicy {
    /**
     * Lowest-indexed baseline within tolerance.
     */
    FIRST_MATCH,
    /**
     * Closest baseline within tolerance, lower index on ties.
     */
    NEAREST
}
