package im.arun.finstream.layout;

import im.arun.finstream.model.PageToken;
import im.arun.finstream.model.TokenRow;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RowGrouperTest {

    private static List<String> texts(TokenRow row) {
        return row.getTokens().stream().map(PageToken::getText).collect(Collectors.toList());
    }

    @Test
    void groupsTokensSharingALineAndOrdersRowsTopToBottom() {
        List<PageToken> tokens = List.of(
            new PageToken("(567)", 10, 120),
            new PageToken("1,234", 200, 100),
            new PageToken("Revenue", 10, 100));

        List<TokenRow> rows = new RowGrouper(5).group(tokens);

        assertEquals(2, rows.size());
        assertEquals(List.of("Revenue", "1,234"), texts(rows.get(0)));
        assertEquals(List.of("(567)"), texts(rows.get(1)));
    }

    @Test
    void rowsCoverEveryTokenAndKeepLeftToRightOrder() {
        List<PageToken> tokens = List.of(
            new PageToken("c", 300, 51),
            new PageToken("a", 10, 50),
            new PageToken("b", 150, 49),
            new PageToken("e", 90, 80),
            new PageToken("d", 20, 81));

        List<TokenRow> rows = new RowGrouper(2).group(tokens);

        Set<PageToken> seen = new HashSet<>();
        for (TokenRow row : rows) {
            assertFalse(row.isEmpty());
            seen.addAll(row.getTokens());
            for (int i = 1; i < row.size(); i++) {
                assertTrue(row.getTokens().get(i - 1).getX0() <= row.getTokens().get(i).getX0());
            }
        }
        assertEquals(new HashSet<>(tokens), seen);
        assertEquals(List.of("a", "b", "c"), texts(rows.get(0)));
        assertEquals(List.of("d", "e"), texts(rows.get(1)));
    }

    @Test
    void lastRowIsSortedByLeftEdgeToo() {
        List<PageToken> tokens = List.of(
            new PageToken("right", 200, 100),
            new PageToken("left", 10, 101));

        List<TokenRow> rows = new RowGrouper(3).group(tokens);

        assertEquals(1, rows.size());
        assertEquals(List.of("left", "right"), texts(rows.get(0)));
    }

    @Test
    void firstMemberAnchorDoesNotMoveWithinARow() {
        List<PageToken> tokens = List.of(
            new PageToken("a", 10, 100),
            new PageToken("b", 20, 103),
            new PageToken("c", 30, 104));

        List<TokenRow> rows = new RowGrouper(3, AnchorPolicy.FIRST_MEMBER).group(tokens);

        assertEquals(2, rows.size());
        assertEquals(List.of("a", "b"), texts(rows.get(0)));
        assertEquals(List.of("c"), texts(rows.get(1)));
    }

    @Test
    void runningCentroidAnchorFollowsTheRowMean() {
        List<PageToken> tokens = List.of(
            new PageToken("a", 10, 100),
            new PageToken("b", 20, 103),
            new PageToken("c", 30, 104));

        List<TokenRow> rows = new RowGrouper(3, AnchorPolicy.RUNNING_CENTROID).group(tokens);

        assertEquals(1, rows.size());
        assertEquals(List.of("a", "b", "c"), texts(rows.get(0)));
    }

    @Test
    void zeroToleranceSeparatesAnyVerticalOffset() {
        List<PageToken> tokens = List.of(
            new PageToken("a", 10, 100f),
            new PageToken("b", 20, 100.5f),
            new PageToken("c", 30, 100f));

        List<TokenRow> rows = new RowGrouper(0).group(tokens);

        assertEquals(2, rows.size());
        assertEquals(List.of("a", "c"), texts(rows.get(0)));
        assertEquals(List.of("b"), texts(rows.get(1)));
    }

    @Test
    void emptyPageYieldsNoRows() {
        assertTrue(new RowGrouper(3).group(List.of()).isEmpty());
    }

    @Test
    void rejectsNegativeTolerance() {
        assertThrows(IllegalArgumentException.class, () -> new RowGrouper(-1));
    }
}
