package im.arun.legisindex.definitions;

import im.arun.legisindex.extract.MetadataExtractor;
import im.arun.legisindex.model.DefinitionScope;
import im.arun.legisindex.model.Language;
import im.arun.legisindex.model.LimsMetadata;
import im.arun.legisindex.model.ParsedDefinedTerm;
import im.arun.legisindex.xml.Elements;
import im.arun.legisindex.xml.TextExtractor;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns a {@code Definition} element into one {@link ParsedDefinedTerm} per term it
 * defines, paired with the matching term in the other official language.
 *
 * <p>Bilingual documents mark both forms, for example
 * {@code <DefinedTermEn>barrier</DefinedTermEn> ... (<DefinedTermFr>obstacle</DefinedTermFr>)}.
 * Terms are paired by position; a lone other-language term is shared by every primary
 * term. When the other language is not marked up at all, short italic spans in the
 * definition are used instead. That fallback can pick up italic text that is not a
 * term (a Latin phrase, a ship name) and is switchable.
 */
public class DefinedTermExtractor {

    private static final Pattern CITATION = Pattern.compile(
            "(?:^|\\s)(?:R\\.S\\.|S\\.C\\.|R\\.S\\.C\\.|L\\.R\\.|L\\.C\\.|L\\.R\\.C\\.|SOR|DORS|TR|SI|C\\.R\\.C\\.|c\\.|ch\\.|art\\.)(?=\\s|\\d|$)");
    private static final Pattern YEAR = Pattern.compile("^\\d{4}$");
    private static final Pattern SENTENCE_END = Pattern.compile("[.;:!?]$");
    private static final Pattern WRAPPING = Pattern.compile("^[\\s(\\[«“\"]+|[\\s)\\]»”\",]+$");

    private final boolean emphasisPairing;
    private final int emphasisMaxWords;
    private final int emphasisMaxLength;

    public DefinedTermExtractor(boolean emphasisPairing, int emphasisMaxWords, int emphasisMaxLength) {
        this.emphasisPairing = emphasisPairing;
        this.emphasisMaxWords = emphasisMaxWords;
        this.emphasisMaxLength = emphasisMaxLength;
    }

    /**
     * Terms defined by a {@code Definition} element.
     */
    public List<ParsedDefinedTerm> fromDefinition(Element definition, TermOwner owner, DefinitionScope scope,
                                                  int definitionOrder) {
        Element text = Elements.child(definition, "Text");
        if (text == null) {
            return List.of();
        }
        return extract(definition, text, owner, scope, definitionOrder, MetadataExtractor.lims(definition));
    }

    /**
     * Terms marked directly in a {@code Text} element with no {@code Definition} wrapper.
     */
    public List<ParsedDefinedTerm> fromInlineText(Element text, TermOwner owner, DefinitionScope scope,
                                                  int definitionOrder) {
        return extract(text, text, owner, scope, definitionOrder, null);
    }

    /**
     * True when a {@code Text} element directly holds a defined-term marker.
     */
    public static boolean hasInlineTerm(Element text) {
        return text != null
                && (Elements.child(text, "DefinedTermEn") != null || Elements.child(text, "DefinedTermFr") != null);
    }

    private List<ParsedDefinedTerm> extract(Element root, Element text, TermOwner owner, DefinitionScope scope,
                                            int definitionOrder, LimsMetadata lims) {
        Language language = owner.getLanguage();
        String primaryTag = termTag(language);
        String otherTag = termTag(language.other());

        List<String> primary = new ArrayList<>();
        collectTerms(text, primaryTag, primary);
        List<String> other = new ArrayList<>();
        collectTerms(root, otherTag, other);

        List<String> terms = primary.isEmpty() ? other : primary;
        List<String> pairs = primary.isEmpty() ? List.of() : other;
        if (terms.isEmpty()) {
            return List.of();
        }
        if (pairs.isEmpty() && !primary.isEmpty() && emphasisPairing) {
            pairs = emphasisCandidates(root);
        }

        String definitionText = TextExtractor.text(root);
        List<ParsedDefinedTerm> result = new ArrayList<>(terms.size());
        for (int i = 0; i < terms.size(); i++) {
            String term = terms.get(i);
            String paired = i < pairs.size() ? pairs.get(i) : (pairs.size() == 1 ? pairs.get(0) : null);
            result.add(ParsedDefinedTerm.builder()
                    .language(language)
                    .term(term)
                    .termNormalized(TermNormalizer.normalize(term))
                    .pairedTerm(paired)
                    .definition(definitionText)
                    .actId(owner.getActId())
                    .regulationId(owner.getRegulationId())
                    .sectionLabel(owner.getSectionLabel())
                    .definitionOrder(definitionOrder)
                    .scopeType(scope.getScopeType())
                    .scopeSections(scope.getSections())
                    .scopeRawText(scope.getRawText())
                    .limsMetadata(lims)
                    .build());
        }
        return result;
    }

    private static String termTag(Language language) {
        return language == Language.FR ? "DefinedTermFr" : "DefinedTermEn";
    }

    /**
     * Terms under {@code parent} in document order, not looking inside nested definitions.
     */
    private static void collectTerms(Element parent, String tag, List<String> out) {
        for (Element child : Elements.children(parent)) {
            String name = Elements.localName(child);
            if (name.equals(tag)) {
                String term = TextExtractor.text(child);
                if (!term.isEmpty()) {
                    out.add(term);
                }
            } else if (!name.equals("Definition")) {
                collectTerms(child, tag, out);
            }
        }
    }

    List<String> emphasisCandidates(Element root) {
        List<String> result = new ArrayList<>();
        collectEmphasis(root, result);
        return result;
    }

    private void collectEmphasis(Element parent, List<String> out) {
        for (Element child : Elements.children(parent)) {
            String name = Elements.localName(child);
            if (name.equals("Emphasis")) {
                String style = Elements.attr(child, "style");
                String candidate = WRAPPING.matcher(TextExtractor.text(child)).replaceAll("");
                if ("italic".equals(style) && looksLikeTerm(candidate)) {
                    out.add(candidate);
                }
            } else if (!name.equals("Definition") && !name.startsWith("DefinedTerm")) {
                collectEmphasis(child, out);
            }
        }
    }

    boolean looksLikeTerm(String candidate) {
        if (candidate.isEmpty() || candidate.length() > emphasisMaxLength) {
            return false;
        }
        if (candidate.split("\\s+").length > emphasisMaxWords) {
            return false;
        }
        if (SENTENCE_END.matcher(candidate).find()) {
            return false;
        }
        if (YEAR.matcher(candidate).matches()) {
            return false;
        }
        return !CITATION.matcher(candidate).find();
    }
}
