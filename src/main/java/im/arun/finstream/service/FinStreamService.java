package im.arun.finstream.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.finstream.config.StreamerConfig;
import im.arun.finstream.layout.ColumnIndexer;
import im.arun.finstream.layout.CoordinateClusterer;
import im.arun.finstream.layout.RowGrouper;
import im.arun.finstream.model.DocumentStream;
import im.arun.finstream.model.PageStream;
import im.arun.finstream.model.PageToken;
import im.arun.finstream.model.RunCounters;
import im.arun.finstream.model.TokenRow;
import im.arun.finstream.pdf.PdfWordExtractor;
import im.arun.finstream.pdf.TokenCounter;
import im.arun.finstream.stream.PageStreamSerializer;
import im.arun.finstream.text.NumericTagger;
import im.arun.finstream.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Runs the layout pipeline over a whole document.
 *
 * <p>Pages are processed strictly in document order. Every call to one of the
 * {@code process*} methods is a separate run with its own {@link RunCounters}, so row and
 * value ids restart at 1 per document and never collide between runs.
 */
public class FinStreamService {
    private static final Logger logger = LoggerFactory.getLogger(FinStreamService.class);
    private static final TypeReference<List<List<PageToken>>> PAGES_TYPE = new TypeReference<>() {};

    private final StreamerConfig config;
    private final RowGrouper rowGrouper;
    private final CoordinateClusterer coordinateClusterer;
    private final PageStreamSerializer serializer;
    private final PdfWordExtractor wordExtractor;
    private final TokenCounter tokenCounter;
    private final ObjectMapper objectMapper;

    public FinStreamService(StreamerConfig config) {
        this.config = config;
        this.rowGrouper = new RowGrouper(config.getVerticalTolerance(), config.getAnchorPolicy());
        this.coordinateClusterer = new CoordinateClusterer(config.getHorizontalTolerance(), config.getAnchorPolicy());
        this.serializer = new PageStreamSerializer(
            new ColumnIndexer(config.getHorizontalTolerance(), config.getColumnMatchPolicy()),
            new TextNormalizer(),
            new NumericTagger(config.getNumericMatchPolicy(), config.isMaskValues(), config.getMaskChar()));
        this.wordExtractor = new PdfWordExtractor(config.getWordGapTolerance());
        this.tokenCounter = config.isCountLlmTokens() ? new TokenCounter() : null;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Main processing pipeline for PDF documents.
     */
    public DocumentStream processPdf(Path pdfPath) throws IOException {
        logger.info("Starting stream generation for {}", pdfPath);
        List<List<PageToken>> pages = wordExtractor.extractPages(pdfPath);
        return processPages(pdfPath.getFileName().toString(), pages);
    }

    /**
     * Process tokens delivered by an external extractor as JSON: an array with one array of
     * {@code {"text", "x0", "top"}} objects per page.
     */
    public DocumentStream processTokenFile(Path tokensPath) throws IOException {
        logger.info("Reading pre-extracted tokens from {}", tokensPath);
        List<List<PageToken>> pages = objectMapper.readValue(tokensPath.toFile(), PAGES_TYPE);
        return processPages(tokensPath.getFileName().toString(), pages);
    }

    public DocumentStream processPages(String docName, List<List<PageToken>> pages) {
        RunCounters counters = new RunCounters();
        DocumentStream document = new DocumentStream();
        document.setDocName(docName);
        document.setPageCount(pages.size());

        for (int i = 0; i < pages.size(); i++) {
            processPage(i + 1, pages.get(i), counters).ifPresent(document.getPages()::add);
        }

        logger.info("Streamed {} of {} pages: {} rows, {} values",
            document.getPages().size(), pages.size(), counters.rowsEmitted(), counters.valuesEmitted());
        return document;
    }

    /**
     * Build one page's stream, drawing ids from the run's counters.
     *
     * @param pageNumber 1-based position of the page in the document
     * @return empty when the page has no tokens
     */
    public Optional<PageStream> processPage(int pageNumber, List<PageToken> tokens, RunCounters counters) {
        if (tokens == null || tokens.isEmpty()) {
            logger.debug("Page {} has no tokens, skipping", pageNumber);
            return Optional.empty();
        }

        List<TokenRow> rows = rowGrouper.group(tokens);
        List<Float> baselines = coordinateClusterer.clusterRows(rows);
        PageStream page = serializer.serializePage(pageNumber, rows, baselines, counters);

        if (tokenCounter != null) {
            page.setLlmTokenCount(tokenCounter.countTokens(page.render(), config.getModel()));
        }

        logger.debug("Page {}: {} tokens, {} rows, {} columns, {} values",
            pageNumber, tokens.size(), page.getRowCount(), page.getColumnCount(), page.getValueCount());
        return Optional.of(page);
    }

    public StreamerConfig getConfig() {
        return config;
    }
}
