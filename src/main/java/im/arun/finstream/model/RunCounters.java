package im.arun.finstream.model;

/**
 * Row and value identifier sequences for one document run.
 *
 * <p>Both sequences start at 1 and are shared by every page of the run, so identifiers are
 * unique and increase in emission order across the whole document. An instance belongs to a
 * single run and is not thread-safe; concurrent runs each need their own.
 */
public final class RunCounters {
    private int rowCounter;
    private int valueCounter;

    public int nextRowId() {
        return ++rowCounter;
    }

    public int nextValueId() {
        return ++valueCounter;
    }

    /**
     * Number of row ids handed out so far.
     */
    public int rowsEmitted() {
        return rowCounter;
    }

    /**
     * Number of value ids handed out so far.
     */
    public int valuesEmitted() {
        return valueCounter;
    }

    @Override
    public String toString() {
        return "RunCounters{rows=" + rowCounter + ", values=" + valueCounter + "}";
    }
}
