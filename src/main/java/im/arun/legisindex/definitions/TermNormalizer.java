package im.arun.legisindex.definitions;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Matching key for defined terms. Dashes become spaces and everything outside
 * {@code [a-z0-9_]} and whitespace is removed, so accented letters disappear:
 * {@code "Canada–Colombia"} gives {@code "canada colombia"}, {@code "l'accès"} gives
 * {@code "laccs"}.
 */
public final class TermNormalizer {
    private static final Pattern DASHES = Pattern.compile("[\\u2013\\u2014-]");
    private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9_\\s]");
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private TermNormalizer() {}

    public static String normalize(String term) {
        String value = DASHES.matcher(term).replaceAll(" ").toLowerCase(Locale.ROOT);
        value = NON_WORD.matcher(value).replaceAll("");
        return SPACES.matcher(value).replaceAll(" ").trim();
    }
}
