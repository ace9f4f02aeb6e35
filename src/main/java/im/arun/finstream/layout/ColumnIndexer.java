package im.arun.finstream.layout;

import java.util.List;

/**
 * Maps a token's left edge to the 1-based index of a page baseline.
 * Origins that qualify for no baseline fall back to column 1.
 */
public class ColumnIndexer {
    static final int FALLBACK_COLUMN = 1;

    private final float xTolerance;
    private final ColumnMatchPolicy matchPolicy;

    public ColumnIndexer(float xTolerance) {
        this(xTolerance, ColumnMatchPolicy.FIRST_MATCH);
    }

    public ColumnIndexer(float xTolerance, ColumnMatchPolicy matchPolicy) {
        if (xTolerance < 0) {
            throw new IllegalArgumentException("xTolerance must be non-negative: " + xTolerance);
        }
        this.xTolerance = xTolerance;
        this.matchPolicy = matchPolicy;
    }

    public int columnOf(float x0, List<Float> baselines) {
        switch (matchPolicy) {
            case NEAREST:
                return nearestMatch(x0, baselines);
            case FIRST_MATCH:
            default:
                return firstMatch(x0, baselines);
        }
    }

    private int firstMatch(float x0, List<Float> baselines) {
        for (int i = 0; i < baselines.size(); i++) {
            if (Math.abs(x0 - baselines.get(i)) <= xTolerance) {
                return i + 1;
            }
        }
        return FALLBACK_COLUMN;
    }

    private int nearestMatch(float x0, List<Float> baselines) {
        int best = FALLBACK_COLUMN;
        float bestDistance = Float.MAX_VALUE;
        for (int i = 0; i < baselines.size(); i++) {
            float distance = Math.abs(x0 - baselines.get(i));
            if (distance <= xTolerance && distance < bestDistance) {
                bestDistance = distance;
                best = i + 1;
            }
        }
        return best;
    }
}
