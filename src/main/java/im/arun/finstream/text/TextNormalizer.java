package im.arun.finstream.text;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonicalizes the sign and separator conventions of Japanese financial statements.
 *
 * <ol>
 *   <li>{@code △} and {@code ▲} become {@code -}</li>
 *   <li>thousands separators {@code ,} and {@code ，} are removed</li>
 *   <li>a fully parenthesized numeral such as {@code (567)} becomes {@code -567}</li>
 * </ol>
 * Everything else, including units, currency symbols and percent signs, is left as is.
 */
public class TextNormalizer {
    private static final Pattern PARENTHESIZED_NUMERAL =
        Pattern.compile("^[(（]([0-9０-９]+(?:[.．][0-9０-９]+)?)[)）]$");

    public String normalize(String raw) {
        String text = replaceSignGlyphs(raw);
        text = stripThousandsSeparators(text);

        Matcher matcher = PARENTHESIZED_NUMERAL.matcher(text);
        if (matcher.matches()) {
            return "-" + matcher.group(1);
        }
        return text;
    }

    static String replaceSignGlyphs(String text) {
        return text.replace('△', '-').replace('▲', '-');
    }

    static String stripThousandsSeparators(String text) {
        return text.replace(",", "").replace("，", "");
    }
}
