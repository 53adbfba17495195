package im.arun.legisindex.extract;

import im.arun.legisindex.model.TreatyContent;
import im.arun.legisindex.xml.Elements;
import im.arun.legisindex.xml.TextExtractor;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Treaties, conventions and agreements reproduced in a schedule or at document level.
 * Their headings and definitions belong to the treaty, not to the enclosing document,
 * so the walk hands them here instead of descending into them.
 */
public final class TreatyExtractor {

    public static final Set<String> TREATY_TAGS =
            Set.of("TreatyAgreement", "Convention", "Agreement", "ConventionAgreementTreaty");

    private TreatyExtractor() {}

    public static boolean isTreaty(Element el) {
        return TREATY_TAGS.contains(Elements.localName(el));
    }

    /**
     * @return the treaty content, or null when the element has no text
     */
    public static TreatyContent extract(Element treaty) {
        String text = TextExtractor.text(treaty);
        if (text.isEmpty()) {
            return null;
        }
        List<Element> headings = Elements.children(treaty, "Heading");
        String title = headings.isEmpty()
                ? null
                : TextExtractor.textOrNull(Elements.child(headings.get(0), "TitleText"));

        List<TreatyContent.Heading> sections = new ArrayList<>();
        for (Element heading : headings) {
            String label = TextExtractor.textOrNull(Elements.child(heading, "Label"));
            String headingTitle = TextExtractor.textOrNull(Elements.child(heading, "TitleText"));
            // the first unlabelled heading is the treaty title
            if (label == null && sections.isEmpty()) {
                continue;
            }
            if (label != null || headingTitle != null) {
                Integer level = Elements.intAttr(heading, "level");
                sections.add(new TreatyContent.Heading(level != null && level > 0 ? level : 1, label, headingTitle));
            }
        }

        List<TreatyContent.Definition> definitions = new ArrayList<>();
        for (Element definition : Elements.descendants(treaty, "Definition")) {
            Element textEl = Elements.child(definition, "Text");
            if (textEl == null) {
                continue;
            }
            Element termEl = Elements.child(textEl, "DefinedTermEn");
            if (termEl == null) {
                termEl = Elements.child(textEl, "DefinedTermFr");
            }
            String term = TextExtractor.textOrNull(termEl);
            if (term != null) {
                definitions.add(new TreatyContent.Definition(term, TextExtractor.text(textEl)));
            }
        }

        return TreatyContent.builder()
                .title(title)
                .sections(sections.isEmpty() ? null : sections)
                .definitions(definitions.isEmpty() ? null : definitions)
                .text(text)
                .build();
    }
}
