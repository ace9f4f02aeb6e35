package im.arun.finstream.pdf;

import im.arun.finstream.model.PageToken;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Word-level token extractor using Apache PDFBox.
 * Produces one token list per page; pages without text yield an empty list.
 */
public class PdfWordExtractor {
    private static final Logger logger = LoggerFactory.getLogger(PdfWordExtractor.class);
    private final float wordGapTolerance;

    public PdfWordExtractor() {
        this(3f);
    }

    /**
     * @param wordGapTolerance horizontal gap between two glyphs, in points, above which they
     *                         belong to different words
     */
    public PdfWordExtractor(float wordGapTolerance) {
        this.wordGapTolerance = wordGapTolerance;
    }

    public List<List<PageToken>> extractPages(Path pdfPath) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdfPath.toFile())) {
            return extractPages(document);
        }
    }

    public List<List<PageToken>> extractPages(byte[] pdfBytes) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            return extractPages(document);
        }
    }

    public List<List<PageToken>> extractPages(InputStream inputStream) throws IOException {
        return extractPages(inputStream.readAllBytes());
    }

    /**
     * Extract words from an already opened document. The caller keeps ownership of it.
     */
    public List<List<PageToken>> extractPages(PDDocument document) throws IOException {
        int totalPages = document.getNumberOfPages();
        List<List<PageToken>> pages = new ArrayList<>(totalPages);
        WordStripper stripper = new WordStripper();

        for (int i = 0; i < totalPages; i++) {
            stripper.words = new ArrayList<>();
            stripper.setStartPage(i + 1);
            stripper.setEndPage(i + 1);
            stripper.getText(document);
            pages.add(stripper.words);
        }

        logger.info("Extracted words from {} pages", totalPages);
        return pages;
    }

    private final class WordStripper extends PDFTextStripper {
        private List<PageToken> words = new ArrayList<>();

        WordStripper() throws IOException {
            setSortByPosition(true);
        }

        @Override
        protected void writeString(String text, List<TextPosition> textPositions) {
            List<TextPosition> word = new ArrayList<>();
            TextPosition previous = null;

            for (TextPosition glyph : textPositions) {
                String unicode = glyph.getUnicode();
                if (unicode == null || unicode.isBlank()) {
                    flush(word);
                    previous = null;
                    continue;
                }
                if (previous != null && gapBetween(previous, glyph) > wordGapTolerance) {
                    flush(word);
                }
                word.add(glyph);
                previous = glyph;
            }
            flush(word);
        }

        private float gapBetween(TextPosition left, TextPosition right) {
            return right.getXDirAdj() - (left.getXDirAdj() + left.getWidthDirAdj());
        }

        private void flush(List<TextPosition> word) {
            if (word.isEmpty()) {
                return;
            }
            StringBuilder text = new StringBuilder();
            float top = Float.MAX_VALUE;
            for (TextPosition glyph : word) {
                text.append(glyph.getUnicode());
                // yDirAdj is the baseline measured from the top edge
                top = Math.min(top, glyph.getYDirAdj() - glyph.getHeightDir());
            }
            words.add(new PageToken(text.toString(), word.get(0).getXDirAdj(), top));
            word.clear();
        }
    }
}
