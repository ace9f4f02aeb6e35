package im.arun.finstream.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Tokens judged to share one text line, ordered left to right by {@code x0}.
 */
public final class TokenRow {
    private final List<PageToken> tokens;

    public TokenRow(List<PageToken> members) {
        List<PageToken> sorted = new ArrayList<>(members);
        sorted.sort(Comparator.comparingDouble(PageToken::getX0));
        this.tokens = Collections.unmodifiableList(sorted);
    }

    public List<PageToken> getTokens() {
        return tokens;
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public int size() {
        return tokens.size();
    }

    public PageToken first() {
        return tokens.get(0);
    }

    @Override
    public String toString() {
        return "TokenRow" + tokens;
    }
}
