package im.arun.finstream.layout;

/**
 * What a new coordinate is compared against when deciding whether it joins the open group.
 */
public enum AnchorPolicy {
    /**
     * The first member of the open group (row's first token, cluster's seed baseline).
     */
    FIRST_MEMBER,
    /**
     * Mean of the members accepted into the open group so far.
     * An alternate to {@link #FIRST_MEMBER}; it changes grouping results.
     */
    RUNNING_CENTROID
}
