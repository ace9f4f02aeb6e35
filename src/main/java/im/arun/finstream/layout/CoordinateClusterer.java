package im.arun.finstream.layout;

import im.arun.finstream.model.PageToken;
import im.arun.finstream.model.TokenRow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Greedy one-dimensional clustering of left edges into column baselines.
 *
 * <p>Coordinates are visited in ascending order. A coordinate further than {@code xTolerance}
 * to the right of the open cluster's anchor seeds a new cluster; anything else is absorbed and
 * dropped. Only seed values survive, so every baseline is the leftmost origin of its column.
 */
public class CoordinateClusterer {
    private final float xTolerance;
    private final AnchorPolicy anchorPolicy;

    public CoordinateClusterer(float xTolerance) {
        this(xTolerance, AnchorPolicy.FIRST_MEMBER);
    }

    public CoordinateClusterer(float xTolerance, AnchorPolicy anchorPolicy) {
        if (xTolerance < 0) {
            throw new IllegalArgumentException("xTolerance must be non-negative: " + xTolerance);
        }
        this.xTolerance = xTolerance;
        this.anchorPolicy = anchorPolicy;
    }

    /**
     * Cluster raw x-coordinates.
     *
     * @return strictly ascending baselines; empty for empty input
     */
    public List<Float> cluster(Collection<Float> coordinates) {
        List<Float> baselines = new ArrayList<>();
        if (coordinates.isEmpty()) {
            return baselines;
        }

        List<Float> sorted = new ArrayList<>(coordinates);
        sorted.sort(null);

        float seed = sorted.get(0);
        baselines.add(seed);
        double anchor = seed;
        double sum = seed;
        int members = 1;

        for (int i = 1; i < sorted.size(); i++) {
            float c = sorted.get(i);
            if (c > anchor + xTolerance) {
                baselines.add(c);
                anchor = c;
                sum = c;
                members = 1;
            } else if (anchorPolicy == AnchorPolicy.RUNNING_CENTROID) {
                sum += c;
                members++;
                anchor = sum / members;
            }
        }
        return baselines;
    }

    /**
     * Baselines for every token origin of a page's rows.
     */
    public List<Float> clusterRows(List<TokenRow> rows) {
        List<Float> origins = new ArrayList<>();
        for (TokenRow row : rows) {
            for (PageToken token : row.getTokens()) {
                origins.add(token.getX0());
            }
        }
        return cluster(origins);
    }

    public float getXTolerance() {
        return xTolerance;
    }
}
