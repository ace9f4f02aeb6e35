package im.arun.finstream.layout;

import im.arun.finstream.model.PageToken;
import im.arun.finstream.model.TokenRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Partitions a page's tokens into text lines by vertical proximity.
 *
 * <p>Tokens are visited in {@code (top, x0)} order. A token joins the open row when its
 * {@code top} lies within {@code yTolerance} of the row's anchor; otherwise the open row is
 * closed and the token starts a new one. With {@link AnchorPolicy#FIRST_MEMBER} the anchor is
 * the {@code top} of the token that opened the row and is never moved while the row is open.
 */
public class RowGrouper {
    private static final Logger logger = LoggerFactory.getLogger(RowGrouper.class);

    private static final Comparator<PageToken> READING_ORDER = Comparator
        .comparingDouble(PageToken::getTop)
        .thenComparingDouble(PageToken::getX0);

    private final float yTolerance;
    private final AnchorPolicy anchorPolicy;

    public RowGrouper(float yTolerance) {
        this(yTolerance, AnchorPolicy.FIRST_MEMBER);
    }

    public RowGrouper(float yTolerance, AnchorPolicy anchorPolicy) {
        if (yTolerance < 0) {
            throw new IllegalArgumentException("yTolerance must be non-negative: " + yTolerance);
        }
        this.yTolerance = yTolerance;
        this.anchorPolicy = anchorPolicy;
    }

    /**
     * Group tokens into rows in top-to-bottom discovery order.
     *
     * @param tokens all tokens of one page, in any order
     * @return rows, each sorted left to right; empty when {@code tokens} is empty
     */
    public List<TokenRow> group(List<PageToken> tokens) {
        List<TokenRow> rows = new ArrayList<>();
        if (tokens.isEmpty()) {
            return rows;
        }

        // List.sort is stable, equal (top, x0) keep delivery order
        List<PageToken> sorted = new ArrayList<>(tokens);
        sorted.sort(READING_ORDER);

        List<PageToken> current = new ArrayList<>();
        double anchor = sorted.get(0).getTop();
        double topSum = 0;

        for (PageToken token : sorted) {
            if (Math.abs(token.getTop() - anchor) <= yTolerance) {
                current.add(token);
                topSum += token.getTop();
                if (anchorPolicy == AnchorPolicy.RUNNING_CENTROID) {
                    anchor = topSum / current.size();
                }
            } else {
                rows.add(new TokenRow(current));
                current = new ArrayList<>();
                current.add(token);
                anchor = token.getTop();
                topSum = token.getTop();
            }
        }
        rows.add(new TokenRow(current));

        logger.debug("Grouped {} tokens into {} rows (yTolerance={}, anchor={})",
            tokens.size(), rows.size(), yTolerance, anchorPolicy);
        return rows;
    }

    public float getYTolerance() {
        return yTolerance;
    }

    public AnchorPolicy getAnchorPolicy() {
        return anchorPolicy;
    }
}
