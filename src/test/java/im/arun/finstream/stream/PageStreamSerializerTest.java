package im.arun.finstream.stream;

import im.arun.finstream.layout.ColumnIndexer;
import im.arun.finstream.model.PageStream;
import im.arun.finstream.model.PageToken;
import im.arun.finstream.model.RunCounters;
import im.arun.finstream.model.TokenRow;
import im.arun.finstream.text.NumericMatchPolicy;
import im.arun.finstream.text.NumericTagger;
import im.arun.finstream.text.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PageStreamSerializerTest {

    private PageStreamSerializer serializer;
    private RunCounters counters;

    @BeforeEach
    void setup() {
        serializer = new PageStreamSerializer(new ColumnIndexer(20), new TextNormalizer(), new NumericTagger());
        counters = new RunCounters();
    }

    @Test
    void rendersRowMarkersColumnsAndValueIds() {
        List<TokenRow> rows = List.of(
            new TokenRow(List.of(new PageToken("Revenue", 10, 100), new PageToken("1,234", 200, 100))),
            new TokenRow(List.of(new PageToken("(567)", 10, 120))));

        PageStream page = serializer.serializePage(1, rows, List.of(10f, 200f), counters);

        assertEquals(List.of(
            "[r_001]<x:010> <col:1, x:010> Revenue <col:2, x:200> <v_001:1234> ",
            "[r_002]<x:010> <col:1, x:010> <v_002:-567> "), page.getLines());
        assertEquals(2, page.getRowCount());
        assertEquals(2, page.getValueCount());
        assertEquals(2, page.getColumnCount());
        assertEquals("=== PAGE 1 [Detected 2 Columns] ===", page.getHeader());
    }

    @Test
    void emptyRowsAreSkippedWithoutConsumingIds() {
        List<TokenRow> rows = List.of(
            new TokenRow(List.of()),
            new TokenRow(List.of(new PageToken("Total", 12.7f, 300))));

        PageStream page = serializer.serializePage(3, rows, List.of(12.7f), counters);

        assertEquals(List.of("[r_001]<x:012> <col:1, x:012> Total "), page.getLines());
        assertEquals(1, counters.rowsEmitted());
    }

    @Test
    void idsContinueFromEarlierPagesOfTheRun() {
        List<TokenRow> first = List.of(new TokenRow(List.of(new PageToken("10", 50, 10))));
        List<TokenRow> second = List.of(new TokenRow(List.of(new PageToken("20", 50, 10))));

        serializer.serializePage(1, first, List.of(50f), counters);
        PageStream page = serializer.serializePage(2, second, List.of(50f), counters);

        assertEquals(List.of("[r_002]<x:050> <col:1, x:050> <v_002:20> "), page.getLines());
        assertEquals(1, page.getValueCount());
    }

    @Test
    void wholeTokenMaskingRendersPlaceholder() {
        PageStreamSerializer masked = new PageStreamSerializer(new ColumnIndexer(20), new TextNormalizer(),
            new NumericTagger(NumericMatchPolicy.WHOLE_TOKEN, true, 'X'));
        List<TokenRow> rows = List.of(new TokenRow(List.of(
            new PageToken("売上高", 5, 10), new PageToken("△2,589", 250, 10))));

        PageStream page = masked.serializePage(1, rows, List.of(5f, 250f), counters);

        assertEquals("[r_001]<x:005> <col:1, x:005> 売上高 <col:2, x:250> <v_001:NUMERIC> ",
            page.getLines().get(0));
    }
}
