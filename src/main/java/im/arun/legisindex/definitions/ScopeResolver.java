package im.arun.legisindex.definitions;

import im.arun.legisindex.model.DefinitionScope;
import im.arun.legisindex.model.LegislationType;
import im.arun.legisindex.model.ScopeType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the applicability of a block of definitions from its lead-in sentence, for
 * example "In this Act," or "The following definitions apply in sections 17 to 19 and
 * 21 to 28." Rules are tried in order and the first match wins; text that matches none
 * applies to the whole document.
 */
public final class ScopeResolver {

    private static final Pattern AND_SECTIONS =
            Pattern.compile("in this section and (?:in )?sections?\\s+((?:\\d|\\s|[.,-]|to|and)+)",
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern AND_ARTICLES =
            Pattern.compile("au présent article et aux articles?\\s*(?:à\\.?)?\\s*((?:\\d|\\s|[.,-]|à|to|et)+)",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern SECTIONS_APPLY =
            Pattern.compile("(?:apply|definitions apply) in sections?\\s*(?:to\\.?)?\\s*((?:\\d|\\s|[.,-]|to|and)+)",
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern ARTICLES_APPLY =
            Pattern.compile("(?:s['’]appliquent|appliquent)\\s*(?:aux|au)\\s*articles?\\s*(?:à\\.?)?\\s*((?:\\d|\\s|[.,-]|à|to|et)+)",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern SECTIONS_TO = Pattern.compile("sections?\\s*to\\.?", Pattern.CASE_INSENSITIVE);
    private static final Pattern ADJACENT_NUMBERS = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s+(\\d+(?:\\.\\d+)?)");
    private static final Pattern RANGE = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(?:to|-|à)\\s*(\\d+(?:\\.\\d+)?)");
    private static final Pattern SINGLE = Pattern.compile("\\b(\\d+(?:\\.\\d+)?)\\b");

    private ScopeResolver() {}

    public static DefinitionScope resolve(String scopeText, String currentLabel, LegislationType documentType) {
        String text = scopeText.toLowerCase(Locale.ROOT);

        if (text.contains("in this act") && !text.contains("in this act and")) {
            return DefinitionScope.of(ScopeType.ACT, scopeText);
        }
        if (text.contains("la présente loi")) {
            return DefinitionScope.of(ScopeType.ACT, scopeText);
        }
        if (text.contains("in this regulation") && !text.contains("sections")) {
            return DefinitionScope.of(ScopeType.REGULATION, scopeText);
        }
        if (text.contains("le présent règlement")) {
            return DefinitionScope.of(ScopeType.REGULATION, scopeText);
        }
        if (text.contains("in this part") && !text.contains("sections")) {
            return DefinitionScope.of(ScopeType.PART, scopeText);
        }
        if (text.contains("dans la présente partie") && !text.contains("articles")) {
            return DefinitionScope.of(ScopeType.PART, scopeText);
        }
        if (text.contains("in this section")) {
            return currentPlus(currentLabel, AND_SECTIONS.matcher(text), scopeText);
        }
        if (text.contains("présent article")) {
            return currentPlus(currentLabel, AND_ARTICLES.matcher(text), scopeText);
        }

        Matcher sections = SECTIONS_APPLY.matcher(text);
        if (sections.find()) {
            List<String> parsed = parseSectionRange(sections.group(1));
            if (!parsed.isEmpty()) {
                return DefinitionScope.ofSections(parsed, scopeText);
            }
        }
        Matcher articles = ARTICLES_APPLY.matcher(text);
        if (articles.find()) {
            List<String> parsed = parseSectionRange(articles.group(1));
            if (!parsed.isEmpty()) {
                return DefinitionScope.ofSections(parsed, scopeText);
            }
        }

        return DefinitionScope.of(ScopeType.forDocument(documentType), scopeText);
    }

    private static DefinitionScope currentPlus(String currentLabel, Matcher additional, String scopeText) {
        Set<String> result = new LinkedHashSet<>();
        if (currentLabel != null) {
            result.add(currentLabel);
        }
        if (additional.find()) {
            result.addAll(parseSectionRange(additional.group(1)));
        }
        return DefinitionScope.ofSections(new ArrayList<>(result), scopeText);
    }

    /**
     * Expands section references such as {@code "17 to 19 and 21 to 28"}. Integer
     * ranges are enumerated; decimal ranges ({@code 90.02 to 90.24}) keep only their
     * endpoints. Text run together by markup, like {@code "sectionsto.73 80"}, is read as
     * {@code "sections 73 to 80"}.
     */
    public static List<String> parseSectionRange(String text) {
        String normalized = SECTIONS_TO.matcher(text).replaceAll("sections ");
        normalized = ADJACENT_NUMBERS.matcher(normalized).replaceAll("$1 to $2");

        Set<String> sections = new LinkedHashSet<>();
        List<int[]> rangeSpans = new ArrayList<>();

        Matcher range = RANGE.matcher(normalized);
        while (range.find()) {
            String start = range.group(1);
            String end = range.group(2);
            rangeSpans.add(new int[] {range.start(), range.end()});
            if (start.contains(".") || end.contains(".")) {
                sections.add(start);
                sections.add(end);
            } else {
                int from = Integer.parseInt(start);
                int to = Integer.parseInt(end);
                for (int i = from; i <= to; i++) {
                    sections.add(String.valueOf(i));
                }
            }
        }

        Matcher single = SINGLE.matcher(normalized);
        while (single.find()) {
            if (!withinRange(single.start(), rangeSpans)) {
                sections.add(single.group(1));
            }
        }
        return new ArrayList<>(sections);
    }

    private static boolean withinRange(int index, List<int[]> rangeSpans) {
        for (int[] span : rangeSpans) {
            if (index >= span[0] && index < span[1]) {
                return true;
            }
        }
        return false;
    }
}
