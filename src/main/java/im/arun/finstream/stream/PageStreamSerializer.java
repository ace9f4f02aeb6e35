package im.arun.finstream.stream;

import im.arun.finstream.layout.ColumnIndexer;
import im.arun.finstream.model.PageStream;
import im.arun.finstream.model.PageToken;
import im.arun.finstream.model.RunCounters;
import im.arun.finstream.model.TokenRow;
import im.arun.finstream.text.NumericTagger;
import im.arun.finstream.text.TextNormalizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a page's rows as the line-oriented geometric stream.
 *
 * <pre>
 * [r_001]&lt;x:010&gt; &lt;col:1, x:010&gt; Revenue &lt;col:2, x:200&gt; &lt;v_001:1234&gt;
 * </pre>
 * Row ids and value ids are drawn from the run's {@link RunCounters} in emission order.
 */
public class PageStreamSerializer {
    private final ColumnIndexer columnIndexer;
    private final TextNormalizer textNormalizer;
    private final NumericTagger numericTagger;

    public PageStreamSerializer(ColumnIndexer columnIndexer,
                                TextNormalizer textNormalizer,
                                NumericTagger numericTagger) {
        this.columnIndexer = columnIndexer;
        this.textNormalizer = textNormalizer;
        this.numericTagger = numericTagger;
    }

    public PageStream serializePage(int pageNumber,
                                    List<TokenRow> rows,
                                    List<Float> baselines,
                                    RunCounters counters) {
        int valuesBefore = counters.valuesEmitted();
        List<String> lines = new ArrayList<>(rows.size());

        for (TokenRow row : rows) {
            if (row.isEmpty()) {
                continue;
            }
            lines.add(serializeRow(row, baselines, counters));
        }

        PageStream page = new PageStream();
        page.setPageNumber(pageNumber);
        page.setBaselines(List.copyOf(baselines));
        page.setRowCount(lines.size());
        page.setValueCount(counters.valuesEmitted() - valuesBefore);
        page.setLines(lines);
        return page;
    }

    String serializeRow(TokenRow row, List<Float> baselines, RunCounters counters) {
        StringBuilder line = new StringBuilder();
        line.append(String.format("[r_%03d]<x:%03d> ", counters.nextRowId(), row.first().truncatedX()));

        for (PageToken token : row.getTokens()) {
            int column = columnIndexer.columnOf(token.getX0(), baselines);
            String text = numericTagger.tag(textNormalizer.normalize(token.getText()), counters);
            line.append(String.format("<col:%d, x:%03d> %s ", column, token.truncatedX(), text));
        }
        return line.toString();
    }
}
